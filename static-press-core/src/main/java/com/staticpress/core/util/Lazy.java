package com.staticpress.core.util;

import java.util.Objects;
import java.util.function.Supplier;

/**
 * Thread-safe memoizing supplier. The delegate runs at most once; a failure is not cached,
 * so the next call retries and fails the same way.
 *
 * @param <T> value type
 */
public final class Lazy<T> implements Supplier<T> {

    private final Supplier<T> delegate;
    private volatile boolean computed;
    private T value;

    private Lazy(Supplier<T> delegate) {
        this.delegate = Objects.requireNonNull(delegate, "delegate must not be null");
    }

    /**
     * Wraps a supplier.
     *
     * @param delegate computation to memoize
     * @param <T> value type
     * @return lazy value
     */
    public static <T> Lazy<T> of(Supplier<T> delegate) {
        return new Lazy<>(delegate);
    }

    /**
     * Wraps an already computed value.
     *
     * @param value value
     * @param <T> value type
     * @return lazy value that is already computed
     */
    public static <T> Lazy<T> value(T value) {
        Lazy<T> lazy = new Lazy<>(() -> value);
        lazy.value = value;
        lazy.computed = true;
        return lazy;
    }

    @Override
    public T get() {
        if (!computed) {
            synchronized (this) {
                if (!computed) {
                    value = delegate.get();
                    computed = true;
                }
            }
        }
        return value;
    }

    /**
     * Returns whether the value has been computed.
     *
     * @return true once {@link #get()} has completed successfully
     */
    public boolean isComputed() {
        return computed;
    }
}
