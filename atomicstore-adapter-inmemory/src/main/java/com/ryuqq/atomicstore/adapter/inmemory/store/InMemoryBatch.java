package com.ryuqq.atomicstore.adapter.inmemory.store;

import com.ryuqq.atomicstore.core.exception.AtomicStoreException;
import com.ryuqq.atomicstore.core.model.BatchResult;
import com.ryuqq.atomicstore.core.model.InsertResult;
import com.ryuqq.atomicstore.core.spi.Batch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.locks.ReentrantLock;

/**
 * In-memory implementation of {@link Batch} bound to one {@link InMemoryAtomicStore}.
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * execute() 호출
 *   ↓
 * jobs snapshot (batch-local lock, executed = true)
 *   ↓
 * For each job → worker task (listener 비활성 내부 경로):
 *   - INSERT / INSERT_UNIQUE: 없던 키 → created, INSERT가 기존 키 덮어씀 → updated
 *   - REMOVE: 실제 삭제 → deleted
 *   ↓
 * 모든 task 완료 대기 (full barrier)
 *   ↓
 * batch listener 호출 (비어있지 않은 집합만, 각 1회)
 * </pre>
 *
 * <p><strong>동시성:</strong></p>
 * <ul>
 *   <li>job 간 실행 순서 보장 없음 (같은 키에 대한 job들은 경합)</li>
 *   <li>각 job은 자신이 관찰한 존재 여부로 독립 분류</li>
 *   <li>job 큐는 store lock과 별개인 batch-local lock으로 보호</li>
 *   <li>단일 사용: 실행 후 재사용 시 IllegalStateException</li>
 * </ul>
 *
 * @param <V> value type
 * @author AtomicStore Team
 * @since 1.0.0
 */
final class InMemoryBatch<V> implements Batch<V> {

    private static final Logger log = LoggerFactory.getLogger(InMemoryBatch.class);

    private final InMemoryAtomicStore<V> store;
    private final ReentrantLock queueLock;
    private final List<BatchJob<V>> jobs;
    private boolean executed;

    InMemoryBatch(InMemoryAtomicStore<V> store) {
        this.store = store;
        this.queueLock = new ReentrantLock();
        this.jobs = new ArrayList<>();
    }

    @Override
    public void insert(String key, V value) {
        requireKey(key);
        requireValue(value);
        enqueue(BatchJob.insert(key, value));
    }

    @Override
    public void insertUnique(String key, V value) {
        requireKey(key);
        requireValue(value);
        enqueue(BatchJob.insertUnique(key, value));
    }

    @Override
    public void remove(String key) {
        requireKey(key);
        enqueue(BatchJob.remove(key));
    }

    @Override
    public BatchResult<V> execute() {
        store.ensureNotDispatching("batch execute");
        List<BatchJob<V>> snapshot = drain();

        if (snapshot.isEmpty()) {
            log.debug("Batch executed with no jobs");
            return BatchResult.empty();
        }

        Map<String, V> created = new ConcurrentHashMap<>();
        Map<String, V> updated = new ConcurrentHashMap<>();
        Map<String, V> deleted = new ConcurrentHashMap<>();

        int workers = Math.min(snapshot.size(), store.config().batchConcurrency());
        ExecutorService workerExecutor = Executors.newFixedThreadPool(
            workers,
            new StoreThreadFactory(store.config().threadNamePrefix() + "-batch")
        );

        try {
            List<Future<?>> futures = new ArrayList<>(snapshot.size());
            for (BatchJob<V> job : snapshot) {
                futures.add(workerExecutor.submit(() -> apply(job, created, updated, deleted)));
            }
            awaitAll(futures);
        } finally {
            workerExecutor.shutdown();
        }

        BatchResult<V> result = new BatchResult<>(created, updated, deleted);
        log.debug("Batch executed: {} jobs on {} workers, {} created, {} updated, {} deleted",
            snapshot.size(), workers, created.size(), updated.size(), deleted.size());

        store.dispatchBatch(result);
        return result;
    }

    @Override
    public int size() {
        queueLock.lock();
        try {
            return jobs.size();
        } finally {
            queueLock.unlock();
        }
    }

    private void enqueue(BatchJob<V> job) {
        queueLock.lock();
        try {
            if (executed) {
                throw new IllegalStateException("batch has already been executed");
            }
            jobs.add(job);
        } finally {
            queueLock.unlock();
        }
    }

    private List<BatchJob<V>> drain() {
        queueLock.lock();
        try {
            if (executed) {
                throw new IllegalStateException("batch has already been executed");
            }
            executed = true;
            return List.copyOf(jobs);
        } finally {
            queueLock.unlock();
        }
    }

    private void apply(BatchJob<V> job, Map<String, V> created, Map<String, V> updated, Map<String, V> deleted) {
        switch (job.type()) {
            case INSERT, INSERT_UNIQUE -> {
                boolean unique = job.type() == BatchJob.Type.INSERT_UNIQUE;
                InsertResult<V> result = store.insert(job.key(), job.value(), unique, false);
                if (!result.existed()) {
                    created.put(job.key(), result.value());
                } else if (!unique) {
                    updated.put(job.key(), result.value());
                }
            }
            case REMOVE -> store.remove(job.key(), false)
                .ifPresent(removed -> deleted.put(job.key(), removed));
        }
    }

    /**
     * Waits for every task, even after one has failed, then reports the first failure.
     *
     * <p>If the caller is interrupted, jobs that have not started are cancelled and never
     * touch the store. A job already applying its mutation completes it.</p>
     *
     * @throws AtomicStoreException if a task failed or the caller was interrupted
     */
    private void awaitAll(List<Future<?>> futures) {
        Throwable firstFailure = null;
        int failed = 0;

        for (Future<?> future : futures) {
            try {
                future.get();
            } catch (ExecutionException e) {
                failed++;
                if (firstFailure == null) {
                    firstFailure = e.getCause();
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                for (Future<?> pending : futures) {
                    pending.cancel(true);
                }
                log.warn("Batch execution interrupted: jobs not yet started were cancelled");
                throw new AtomicStoreException("Interrupted while waiting for batch jobs", e);
            }
        }

        if (firstFailure != null) {
            log.error("Batch execution failed: {} of {} jobs failed", failed, futures.size(), firstFailure);
            throw new AtomicStoreException(
                failed + " of " + futures.size() + " batch jobs failed", firstFailure
            );
        }
    }

    private static void requireKey(String key) {
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
    }

    private static void requireValue(Object value) {
        if (value == null) {
            throw new IllegalArgumentException("value cannot be null");
        }
    }
}
