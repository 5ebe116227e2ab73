package io.github.typexform.util;

import java.util.function.Supplier;

/**
 * A value computed on first access, at most once.
 *
 * @param <T> The type of the value.
 */
public final class Lazy<T> implements Supplier<T> {
    private Supplier<T> thunk;
    private T value;

    public Lazy(Supplier<T> thunk) {
        this.thunk = thunk;
    }

    public static <T> Lazy<T> lazy(Supplier<T> thunk) {
        return new Lazy<>(thunk);
    }

    @Override
    public synchronized T get() {
        if (thunk != null) {
            value = thunk.get();
            thunk = null;
        }
        return value;
    }

    /**
     * Whether the value has been computed yet.
     *
     * @return Whether {@link #get()} has been called successfully.
     */
    public synchronized boolean isForced() {
        return thunk == null;
    }
}
