package io.github.mprelude;

/**
 * Thrown when a combinator is called without its callback, even on a variant that would never invoke it.
 */
public class MissingCallbackException extends PreludeException {
    public MissingCallbackException(String name) {
        super("Missing callback: " + name);
    }
}
