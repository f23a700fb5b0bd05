package com.ryuqq.atomicstore.adapter.inmemory.store;

import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Creates named daemon threads for batch workers and wait helpers.
 *
 * <p>Daemon threads keep a store with no explicit shutdown from holding the JVM open.</p>
 *
 * @author AtomicStore Team
 * @since 1.0.0
 */
final class StoreThreadFactory implements ThreadFactory {

    private final String namePrefix;
    private final AtomicInteger sequence;

    /**
     * @param namePrefix thread name prefix, e.g. "atomicstore-batch"
     */
    StoreThreadFactory(String namePrefix) {
        this.namePrefix = namePrefix;
        this.sequence = new AtomicInteger();
    }

    @Override
    public Thread newThread(Runnable task) {
        Thread thread = new Thread(task, namePrefix + "-" + sequence.incrementAndGet());
        thread.setDaemon(true);
        return thread;
    }
}
