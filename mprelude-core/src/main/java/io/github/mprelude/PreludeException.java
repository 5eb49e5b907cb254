package io.github.mprelude;

public class PreludeException extends RuntimeException {
    public PreludeException(String message) {
        super(message);
    }
}
