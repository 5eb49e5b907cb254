package io.github.mprelude;

@FunctionalInterface
public interface SupplierE<T, E extends Exception> {
    T get() throws E;
}
