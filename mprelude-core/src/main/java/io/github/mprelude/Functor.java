package io.github.mprelude;

import java.util.function.Function;

/**
 * A container whose held value can be transformed without leaving the container.
 *
 * @param <T> type of the held value
 */
public interface Functor<T> {
    /**
     * Applies {@code f} to the held value, if any, keeping the shape of this container.
     *
     * @throws MissingCallbackException if {@code f} is null, whether or not it would be invoked
     */
    <U> Functor<U> fmap(Function<? super T, ? extends U> f);
}
