package io.github.mprelude;

/**
 * Thrown when unwrapping the channel an {@link Either} does not hold and no fallback was given.
 */
public class WrongVariantException extends PreludeException {
    public WrongVariantException(String message) {
        super(message);
    }
}
