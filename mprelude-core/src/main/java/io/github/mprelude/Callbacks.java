package io.github.mprelude;

final class Callbacks {
    private Callbacks() {
    }

    static <F> F requireCallback(F callback, String name) {
        if (callback == null) {
            throw new MissingCallbackException(name);
        }
        return callback;
    }
}
