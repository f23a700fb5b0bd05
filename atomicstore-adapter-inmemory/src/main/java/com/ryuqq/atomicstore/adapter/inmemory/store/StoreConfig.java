package com.ryuqq.atomicstore.adapter.inmemory.store;

/**
 * In-memory store configuration (immutable record).
 *
 * <p><strong>Settings:</strong></p>
 * <ul>
 *   <li>lockable: store-wide lock and change notification enabled (default true)</li>
 *   <li>batchConcurrency: maximum worker threads per batch execution (default 16)</li>
 *   <li>threadNamePrefix: prefix for batch worker and wait helper thread names (default "atomicstore")</li>
 * </ul>
 *
 * <p>Batch workers are sized {@code min(jobCount, batchConcurrency)}, so small batches
 * never start more threads than they have jobs.</p>
 *
 * @author AtomicStore Team
 * @since 1.0.0
 * @param lockable whether the store serializes mutations and supports notification
 * @param batchConcurrency worker thread cap per batch (must be positive)
 * @param threadNamePrefix thread name prefix (must not be blank)
 */
public record StoreConfig(
    boolean lockable,
    int batchConcurrency,
    String threadNamePrefix
) {

    /**
     * Default configuration.
     *
     * <p>Defaults: lockable=true, batchConcurrency=16, threadNamePrefix="atomicstore"</p>
     */
    public StoreConfig() {
        this(true, 16, "atomicstore");
    }

    /**
     * Compact constructor (validation).
     *
     * @throws IllegalArgumentException if a parameter is invalid
     */
    public StoreConfig {
        if (batchConcurrency <= 0) {
            throw new IllegalArgumentException(
                "batchConcurrency must be positive (current: " + batchConcurrency + ")"
            );
        }
        if (threadNamePrefix == null || threadNamePrefix.isBlank()) {
            throw new IllegalArgumentException("threadNamePrefix cannot be null or blank");
        }
    }

    /**
     * Returns a copy with only lockable changed.
     */
    public StoreConfig withLockable(boolean lockable) {
        return new StoreConfig(lockable, batchConcurrency, threadNamePrefix);
    }

    /**
     * Returns a copy with only batchConcurrency changed.
     */
    public StoreConfig withBatchConcurrency(int batchConcurrency) {
        return new StoreConfig(lockable, batchConcurrency, threadNamePrefix);
    }

    /**
     * Returns a copy with only threadNamePrefix changed.
     */
    public StoreConfig withThreadNamePrefix(String threadNamePrefix) {
        return new StoreConfig(lockable, batchConcurrency, threadNamePrefix);
    }
}
