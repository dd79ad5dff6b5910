package io.kubemcp.kubernetes;

import java.util.Objects;
import java.util.function.Supplier;

/**
 * Thread-safe lazy value. The first caller builds it while concurrent callers wait; everyone sees the same
 * instance afterwards.
 */
final class Memoized<T> implements Supplier<T> {

    private final Supplier<T> factory;
    private volatile T value;

    Memoized(Supplier<T> factory) {
        this.factory = Objects.requireNonNull(factory, "factory");
    }

    @Override
    public T get() {
        T result = value;
        if (result == null) {
            synchronized (this) {
                result = value;
                if (result == null) {
                    result = Objects.requireNonNull(factory.get(), "factory returned null");
                    value = result;
                }
            }
        }
        return result;
    }

    /**
     * The value if it has already been built, without triggering construction.
     */
    T getIfBuilt() {
        return value;
    }
}
