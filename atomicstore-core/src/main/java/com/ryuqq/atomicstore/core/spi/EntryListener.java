package com.ryuqq.atomicstore.core.spi;

/**
 * Callback fired for a single insert, update or remove.
 *
 * <p>In lockable mode the listener runs while the store lock is held. It must be
 * short, non-blocking and must not call mutating operations on the same store.</p>
 *
 * @param <V> value type
 * @author AtomicStore Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface EntryListener<V> {

    /**
     * @param key affected key
     * @param value value written, or the value removed
     */
    void onEntry(String key, V value);

    /**
     * Listener that does nothing.
     */
    static <V> EntryListener<V> noOp() {
        return (key, value) -> { };
    }
}
