package io.github.mprelude;

import java.util.Objects;
import java.util.function.Function;

import static io.github.mprelude.Callbacks.requireCallback;
import static java.util.Objects.requireNonNull;

/**
 * A value that is either present ({@link Just}) or absent ({@link Nothing}).
 *
 * @param <T> type of the present value
 */
public abstract class Maybe<T> implements Functor<T> {
    private Maybe() {
    }

    @SuppressWarnings("unchecked")
    public static <T> Maybe<T> nothing() {
        return (Maybe<T>) Nothing.INSTANCE;
    }

    public static <T> Maybe<T> just(T value) {
        return new Just<>(value);
    }

    public static <T> Maybe<T> fromNullable(T nullable) {
        return nullable == null ? nothing() : just(nullable);
    }

    public abstract boolean isJust();

    public final boolean isNothing() {
        return !isJust();
    }

    /**
     * Returns the present value, or null for {@link Nothing}. A {@code Just} holding null also yields null.
     */
    public abstract T toNullable();

    @Override
    public abstract <U> Maybe<U> fmap(Function<? super T, ? extends U> f);

    /**
     * Applies {@code f}, which itself returns a {@code Maybe}, to the present value.
     *
     * @throws MissingCallbackException if {@code f} is null
     */
    public abstract <U> Maybe<U> bind(Function<? super T, Maybe<U>> f);

    public static final class Nothing<T> extends Maybe<T> {
        public static final Nothing<?> INSTANCE = new Nothing<>();

        private Nothing() {
        }

        @Override
        public boolean isJust() {
            return false;
        }

        @Override
        public T toNullable() {
            return null;
        }

        @Override
        public <U> Maybe<U> fmap(Function<? super T, ? extends U> f) {
            requireCallback(f, "f");
            return nothing();
        }

        @Override
        public <U> Maybe<U> bind(Function<? super T, Maybe<U>> f) {
            requireCallback(f, "f");
            return nothing();
        }

        @Override
        public String toString() {
            return "Nothing";
        }
    }

    public static final class Just<T> extends Maybe<T> {
        private final T value;

        public Just(T value) {
            this.value = value;
        }

        public T getValue() {
            return value;
        }

        @Override
        public boolean isJust() {
            return true;
        }

        @Override
        public T toNullable() {
            return value;
        }

        @Override
        public <U> Maybe<U> fmap(Function<? super T, ? extends U> f) {
            return new Just<>(requireCallback(f, "f").apply(value));
        }

        @Override
        public <U> Maybe<U> bind(Function<? super T, Maybe<U>> f) {
            return requireNonNull(requireCallback(f, "f").apply(value), "bind result");
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) {
                return true;
            }
            if (!(o instanceof Just)) {
                return false;
            }
            return Objects.equals(value, ((Just<?>) o).value);
        }

        @Override
        public int hashCode() {
            return Objects.hashCode(value);
        }

        @Override
        public String toString() {
            return "Just(" + value + ")";
        }
    }
}
