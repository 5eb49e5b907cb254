package io.github.mprelude;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Collection;
import java.util.Objects;
import java.util.function.Function;

import static io.github.mprelude.Callbacks.requireCallback;
import static java.util.Objects.requireNonNull;

/**
 * Disjoint union of a {@link Left} value, conventionally a failure, and a {@link Right} value,
 * conventionally a success. Mapping and binding act on the right channel, {@link #lmap} on the left one.
 *
 * @param <L> type of the left value
 * @param <R> type of the right value
 */
public abstract class Either<L, R> implements Functor<R> {
    private static final Logger LOGGER = LogManager.getLogger(Either.class);

    private Either() {
    }

    public static <L, R> Either<L, R> left(L value) {
        return new Left<>(value);
    }

    public static <L, R> Either<L, R> right(R value) {
        return new Right<>(value);
    }

    /**
     * Runs {@code body}, returning its result as a right value. A throwable that is an instance of one of
     * {@code kinds} is returned as a left value; any other throwable propagates unchanged.
     */
    public static <T, X extends Exception> Either<Throwable, T> wrapError(
        Collection<? extends Class<? extends Throwable>> kinds, SupplierE<T, X> body) throws X {
        requireNonNull(kinds, "kinds");
        for (Class<? extends Throwable> kind : kinds) {
            requireNonNull(kind, "kinds must not contain null");
        }
        requireCallback(body, "body");
        try {
            return right(body.get());
        } catch (Throwable throwable) {
            for (Class<? extends Throwable> kind : kinds) {
                if (kind.isInstance(throwable)) {
                    LOGGER.debug("Wrapping {} as left value, matched {}", throwable, kind.getName());
                    return left(throwable);
                }
            }
            throw Either.<X>rethrow(throwable);
        }
    }

    /**
     * Single-kind form of {@link #wrapError(Collection, SupplierE)}, with the left value typed on the caught kind.
     */
    public static <E extends Throwable, T, X extends Exception> Either<E, T> wrapError(
        Class<E> kind, SupplierE<T, X> body) throws X {
        requireNonNull(kind, "kind");
        requireCallback(body, "body");
        try {
            return right(body.get());
        } catch (Throwable throwable) {
            if (kind.isInstance(throwable)) {
                LOGGER.debug("Wrapping {} as left value", throwable);
                return left(kind.cast(throwable));
            }
            throw Either.<X>rethrow(throwable);
        }
    }

    // body can only throw unchecked throwables or its declared X
    @SuppressWarnings("unchecked")
    private static <X extends Exception> RuntimeException rethrow(Throwable throwable) throws X {
        if (throwable instanceof RuntimeException) {
            throw (RuntimeException) throwable;
        }
        if (throwable instanceof Error) {
            throw (Error) throwable;
        }
        throw (X) throwable;
    }

    // a short-circuited variant never holds a value of the channel being retyped
    @SuppressWarnings("unchecked")
    private static <A, B> Either<A, B> retype(Either<?, ?> either) {
        return (Either<A, B>) either;
    }

    public abstract boolean isLeft();

    public final boolean isRight() {
        return !isLeft();
    }

    @Override
    public abstract <U> Either<L, U> fmap(Function<? super R, ? extends U> f);

    public abstract <U> Either<L, U> bind(Function<? super R, Either<L, U>> f);

    /**
     * Maps over the left value, leaving a right value untouched.
     */
    public abstract <M> Either<M, R> lmap(Function<? super L, ? extends M> f);

    public abstract L fromLeft();

    /**
     * Returns the left value, or applies {@code fallback} to the right value. A null fallback behaves like
     * {@link #fromLeft()}.
     */
    public abstract L fromLeft(Function<? super R, ? extends L> fallback);

    public abstract R fromRight();

    /**
     * Returns the right value, or applies {@code fallback} to the left value. A null fallback behaves like
     * {@link #fromRight()}.
     */
    public abstract R fromRight(Function<? super L, ? extends R> fallback);

    /**
     * Applies {@code onLeft} or {@code onRight}, whichever matches this variant. The other one is ignored and may be
     * null.
     */
    public abstract <X> X either(Function<? super L, ? extends X> onLeft, Function<? super R, ? extends X> onRight);

    public static final class Left<L, R> extends Either<L, R> {
        private final L value;

        public Left(L value) {
            this.value = value;
        }

        public L getValue() {
            return value;
        }

        @Override
        public boolean isLeft() {
            return true;
        }

        @Override
        public <U> Either<L, U> fmap(Function<? super R, ? extends U> f) {
            requireCallback(f, "f");
            return retype(this);
        }

        @Override
        public <U> Either<L, U> bind(Function<? super R, Either<L, U>> f) {
            requireCallback(f, "f");
            return retype(this);
        }

        @Override
        public <M> Either<M, R> lmap(Function<? super L, ? extends M> f) {
            return new Left<>(requireCallback(f, "f").apply(value));
        }

        @Override
        public L fromLeft() {
            return value;
        }

        @Override
        public L fromLeft(Function<? super R, ? extends L> fallback) {
            return value;
        }

        @Override
        public R fromRight() {
            throw new WrongVariantException("Expected right value, got " + this);
        }

        @Override
        public R fromRight(Function<? super L, ? extends R> fallback) {
            if (fallback == null) {
                return fromRight();
            }
            return fallback.apply(value);
        }

        @Override
        public <X> X either(Function<? super L, ? extends X> onLeft, Function<? super R, ? extends X> onRight) {
            return requireCallback(onLeft, "onLeft").apply(value);
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) {
                return true;
            }
            if (!(o instanceof Left)) {
                return false;
            }
            return Objects.equals(value, ((Left<?, ?>) o).value);
        }

        @Override
        public int hashCode() {
            return 31 * Left.class.hashCode() + Objects.hashCode(value);
        }

        @Override
        public String toString() {
            return "Left(" + value + ")";
        }
    }

    public static final class Right<L, R> extends Either<L, R> {
        private final R value;

        public Right(R value) {
            this.value = value;
        }

        public R getValue() {
            return value;
        }

        @Override
        public boolean isLeft() {
            return false;
        }

        @Override
        public <U> Either<L, U> fmap(Function<? super R, ? extends U> f) {
            return new Right<>(requireCallback(f, "f").apply(value));
        }

        @Override
        public <U> Either<L, U> bind(Function<? super R, Either<L, U>> f) {
            return requireNonNull(requireCallback(f, "f").apply(value), "bind result");
        }

        @Override
        public <M> Either<M, R> lmap(Function<? super L, ? extends M> f) {
            requireCallback(f, "f");
            return retype(this);
        }

        @Override
        public L fromLeft() {
            throw new WrongVariantException("Expected left value, got " + this);
        }

        @Override
        public L fromLeft(Function<? super R, ? extends L> fallback) {
            if (fallback == null) {
                return fromLeft();
            }
            return fallback.apply(value);
        }

        @Override
        public R fromRight() {
            return value;
        }

        @Override
        public R fromRight(Function<? super L, ? extends R> fallback) {
            return value;
        }

        @Override
        public <X> X either(Function<? super L, ? extends X> onLeft, Function<? super R, ? extends X> onRight) {
            return requireCallback(onRight, "onRight").apply(value);
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) {
                return true;
            }
            if (!(o instanceof Right)) {
                return false;
            }
            return Objects.equals(value, ((Right<?, ?>) o).value);
        }

        @Override
        public int hashCode() {
            return 31 * Right.class.hashCode() + Objects.hashCode(value);
        }

        @Override
        public String toString() {
            return "Right(" + value + ")";
        }
    }
}
