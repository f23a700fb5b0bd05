package com.ryuqq.atomicstore.core.spi;

import java.util.Map;

/**
 * Callback fired once per batch execution with an aggregated result set.
 *
 * <p>Invoked only for non-empty sets, after every job of the batch has finished
 * and outside the store lock.</p>
 *
 * @param <V> value type
 * @author AtomicStore Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface BatchListener<V> {

    /**
     * @param entries immutable key → value map
     */
    void onBatch(Map<String, V> entries);

    /**
     * Listener that does nothing.
     */
    static <V> BatchListener<V> noOp() {
        return entries -> { };
    }
}
