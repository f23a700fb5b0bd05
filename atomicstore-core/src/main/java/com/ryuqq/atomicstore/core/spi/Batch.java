package com.ryuqq.atomicstore.core.spi;

import com.ryuqq.atomicstore.core.model.BatchResult;

/**
 * Queue of mutations applied concurrently against one store.
 *
 * <p>Jobs may be queued from many producers. {@link #execute()} runs every queued job
 * concurrently with per-entry listeners suppressed, waits for all of them, then fires the
 * store's batch listeners once per non-empty result set.</p>
 *
 * <p><strong>Ordering:</strong> jobs are unordered. Two jobs on the same key in one batch
 * leave whichever value committed last, and each is classified by the existence state it
 * observed itself.</p>
 *
 * <p><strong>Lifecycle:</strong></p>
 * <pre>
 * Batch&lt;V&gt; batch = store.batch();
 * batch.insert("a", 1);
 * batch.remove("b");
 * BatchResult&lt;V&gt; result = batch.execute(); // single use
 * </pre>
 *
 * @param <V> value type
 * @author AtomicStore Team
 * @since 1.0.0
 */
public interface Batch<V> {

    /**
     * Queues an overwriting insert.
     *
     * @throws IllegalArgumentException if key or value is null
     * @throws IllegalStateException if the batch was already executed
     */
    void insert(String key, V value);

    /**
     * Queues an insert that is a no-op for existing keys.
     *
     * @throws IllegalArgumentException if key or value is null
     * @throws IllegalStateException if the batch was already executed
     */
    void insertUnique(String key, V value);

    /**
     * Queues a removal.
     *
     * @throws IllegalArgumentException if key is null
     * @throws IllegalStateException if the batch was already executed
     */
    void remove(String key);

    /**
     * Applies all queued jobs concurrently and blocks until every job finished.
     *
     * @return aggregated result of this execution
     * @throws IllegalStateException if the batch was already executed, or if called from an entry listener
     * @throws com.ryuqq.atomicstore.core.exception.AtomicStoreException if a job fails or the caller is interrupted
     */
    BatchResult<V> execute();

    /**
     * @return number of queued jobs
     */
    int size();
}
