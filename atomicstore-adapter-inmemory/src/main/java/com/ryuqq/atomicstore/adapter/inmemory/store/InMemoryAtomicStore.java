package com.ryuqq.atomicstore.adapter.inmemory.store;

import com.ryuqq.atomicstore.adapter.inmemory.notify.ChangeNotifier;
import com.ryuqq.atomicstore.adapter.inmemory.notify.ConditionChangeNotifier;
import com.ryuqq.atomicstore.adapter.inmemory.notify.NoOpChangeNotifier;
import com.ryuqq.atomicstore.core.cancel.CancellationToken;
import com.ryuqq.atomicstore.core.counter.AtomicCounter;
import com.ryuqq.atomicstore.core.model.BatchResult;
import com.ryuqq.atomicstore.core.model.InsertResult;
import com.ryuqq.atomicstore.core.spi.AtomicStore;
import com.ryuqq.atomicstore.core.spi.Batch;
import com.ryuqq.atomicstore.core.spi.BatchListener;
import com.ryuqq.atomicstore.core.spi.EntryListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory implementation of {@link AtomicStore} SPI.
 *
 * <p>Entries live in a {@link ConcurrentHashMap}; the live count is an {@link AtomicCounter}
 * updated in the same step as the map. Locking and notification are delegated to a
 * {@link ChangeNotifier} chosen by {@link StoreConfig#lockable()}.</p>
 *
 * <p><strong>Data Structures:</strong></p>
 * <ul>
 *   <li><strong>entries:</strong> ConcurrentHashMap&lt;String, V&gt; - key → value (O(1) access)</li>
 *   <li><strong>count:</strong> AtomicCounter - number of keys present</li>
 *   <li><strong>notifier:</strong> ConditionChangeNotifier (lockable) or NoOpChangeNotifier</li>
 * </ul>
 *
 * <p><strong>Mutation Protocol (lockable):</strong></p>
 * <pre>
 * lock
 *   map.put / putIfAbsent / remove   → existence decided atomically by the map
 *   count.inc / count.dec
 *   entry listener                   → runs while the lock is held
 * unlock
 * </pre>
 *
 * <p><strong>Listener Rules:</strong></p>
 * <ul>
 *   <li>Exceptions thrown by listeners are logged and never escape the lock</li>
 *   <li>An entry listener calling a mutating operation on this store is rejected
 *       with {@link IllegalStateException} (that rejection is logged by the listener guard)</li>
 *   <li>Batch listeners run after the batch barrier, outside the lock, and may use the store</li>
 *   <li>Registration is a volatile write, not synchronized with in-flight mutations</li>
 * </ul>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * InMemoryAtomicStore&lt;String&gt; store = InMemoryAtomicStore.create(true);
 * store.onInsert((key, value) -&gt; log.info("created {}", key));
 *
 * store.insert("k", "v1");        // (v1, false) → insert listener
 * store.insert("k", "v2");        // (v2, true)  → update listener
 * store.insertUnique("k", "v3");  // (v2, true)  → no listener
 * store.remove("k");              // true        → remove listener
 * </pre>
 *
 * @param <V> value type
 * @author AtomicStore Team
 * @since 1.0.0
 */
public class InMemoryAtomicStore<V> implements AtomicStore<V> {

    private static final Logger log = LoggerFactory.getLogger(InMemoryAtomicStore.class);

    private final ConcurrentHashMap<String, V> entries;
    private final AtomicCounter count;
    private final ChangeNotifier notifier;
    private final StoreConfig config;

    /**
     * Threads currently running an entry listener of this store.
     */
    private final Set<Thread> dispatchingThreads;

    private volatile EntryListener<V> insertListener = EntryListener.noOp();
    private volatile EntryListener<V> updateListener = EntryListener.noOp();
    private volatile EntryListener<V> removeListener = EntryListener.noOp();
    private volatile BatchListener<V> batchInsertListener = BatchListener.noOp();
    private volatile BatchListener<V> batchUpdateListener = BatchListener.noOp();
    private volatile BatchListener<V> batchRemoveListener = BatchListener.noOp();

    /**
     * Creates a store with default configuration (lockable).
     */
    public InMemoryAtomicStore() {
        this(new StoreConfig());
    }

    /**
     * Creates a store with custom configuration.
     *
     * @param config store configuration
     * @throws IllegalArgumentException if config is null
     */
    public InMemoryAtomicStore(StoreConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.entries = new ConcurrentHashMap<>();
        this.count = new AtomicCounter();
        this.config = config;
        this.notifier = config.lockable()
            ? new ConditionChangeNotifier(new StoreThreadFactory(config.threadNamePrefix() + "-wait"))
            : NoOpChangeNotifier.INSTANCE;
        this.dispatchingThreads = ConcurrentHashMap.newKeySet();
    }

    /**
     * Creates a store with default settings and the given lockable mode.
     *
     * @param lockable whether mutations are serialized and notification is enabled
     * @param <V> value type
     * @return a new empty store
     */
    public static <V> InMemoryAtomicStore<V> create(boolean lockable) {
        return new InMemoryAtomicStore<>(new StoreConfig().withLockable(lockable));
    }

    @Override
    public InsertResult<V> insert(String key, V value) {
        return insert(key, value, false, true);
    }

    @Override
    public InsertResult<V> insertUnique(String key, V value) {
        return insert(key, value, true, true);
    }

    @Override
    public boolean remove(String key) {
        return remove(key, true).isPresent();
    }

    @Override
    public Optional<V> get(String key) {
        requireKey(key);
        return Optional.ofNullable(entries.get(key));
    }

    @Override
    public Set<String> keySnapshot() {
        return Set.copyOf(entries.keySet());
    }

    @Override
    public long size() {
        return count.get();
    }

    @Override
    public void flush() {
        ensureNotDispatching("flush");

        int removed = 0;
        for (String key : entries.keySet()) {
            if (remove(key, true).isPresent()) {
                removed++;
            }
        }
        notifier.notifyDidChange();
        log.debug("Store flushed: {} entries removed", removed);
    }

    @Override
    public void notifyDidChange() {
        notifier.notifyDidChange();
    }

    @Override
    public void waitForDataChange(CancellationToken token) {
        if (token == null) {
            throw new IllegalArgumentException("token cannot be null");
        }
        notifier.waitForDataChange(token);
    }

    @Override
    public boolean isLockable() {
        return notifier.isLockable();
    }

    @Override
    public Batch<V> batch() {
        return new InMemoryBatch<>(this);
    }

    @Override
    public void onInsert(EntryListener<V> listener) {
        this.insertListener = requireListener(listener);
    }

    @Override
    public void onUpdate(EntryListener<V> listener) {
        this.updateListener = requireListener(listener);
    }

    @Override
    public void onRemove(EntryListener<V> listener) {
        this.removeListener = requireListener(listener);
    }

    @Override
    public void onBatchInsert(BatchListener<V> listener) {
        this.batchInsertListener = requireListener(listener);
    }

    @Override
    public void onBatchUpdate(BatchListener<V> listener) {
        this.batchUpdateListener = requireListener(listener);
    }

    @Override
    public void onBatchRemove(BatchListener<V> listener) {
        this.batchRemoveListener = requireListener(listener);
    }

    /**
     * Returns the number of threads blocked in {@link #waitForDataChange(CancellationToken)}.
     *
     * <p>This method is useful for testing and debugging.</p>
     *
     * @return waiting thread count (always 0 for non-lockable stores)
     */
    public int waitingThreads() {
        return notifier.waitingThreads();
    }

    /**
     * @return number of threads currently inside an entry listener of this store
     */
    int dispatchingThreadCount() {
        return dispatchingThreads.size();
    }

    StoreConfig config() {
        return config;
    }

    /**
     * Internal insert path shared by single operations and batches.
     *
     * @param unique true for insert-unique semantics
     * @param runListeners false to suppress entry listeners (batch path)
     */
    InsertResult<V> insert(String key, V value, boolean unique, boolean runListeners) {
        requireKey(key);
        requireValue(value);
        ensureNotDispatching(unique ? "insertUnique" : "insert");

        return notifier.runExclusive(() -> {
            if (unique) {
                V existing = entries.putIfAbsent(key, value);
                if (existing != null) {
                    return InsertResult.existing(existing);
                }
                count.inc();
                if (runListeners) {
                    dispatch(insertListener, "insert", key, value);
                }
                return InsertResult.created(value);
            }

            boolean existed = entries.put(key, value) != null;
            if (!existed) {
                count.inc();
            }
            if (runListeners) {
                if (existed) {
                    dispatch(updateListener, "update", key, value);
                } else {
                    dispatch(insertListener, "insert", key, value);
                }
            }
            return new InsertResult<>(value, existed);
        });
    }

    /**
     * Internal remove path shared by single operations, flush and batches.
     *
     * @return the removed value, or empty if the key was absent
     */
    Optional<V> remove(String key, boolean runListeners) {
        requireKey(key);
        ensureNotDispatching("remove");

        return notifier.runExclusive(() -> {
            V removed = entries.remove(key);
            if (removed == null) {
                return Optional.empty();
            }
            count.dec();
            if (runListeners) {
                dispatch(removeListener, "remove", key, removed);
            }
            return Optional.of(removed);
        });
    }

    /**
     * Fires the batch listeners for every non-empty set of {@code result}.
     */
    void dispatchBatch(BatchResult<V> result) {
        dispatchBatch(batchInsertListener, "batch insert", result.created());
        dispatchBatch(batchUpdateListener, "batch update", result.updated());
        dispatchBatch(batchRemoveListener, "batch remove", result.deleted());
    }

    /**
     * @throws IllegalStateException if the current thread is running an entry listener
     */
    void ensureNotDispatching(String operation) {
        if (dispatchingThreads.contains(Thread.currentThread())) {
            throw new IllegalStateException(
                operation + " cannot be called from an entry listener of the same store"
            );
        }
    }

    private void dispatch(EntryListener<V> listener, String kind, String key, V value) {
        Thread current = Thread.currentThread();
        dispatchingThreads.add(current);
        try {
            listener.onEntry(key, value);
        } catch (RuntimeException e) {
            log.error("{} listener failed for key {}", kind, key, e);
        } finally {
            dispatchingThreads.remove(current);
        }
    }

    private void dispatchBatch(BatchListener<V> listener, String kind, Map<String, V> batchEntries) {
        if (batchEntries.isEmpty()) {
            return;
        }
        try {
            listener.onBatch(batchEntries);
        } catch (RuntimeException e) {
            log.error("{} listener failed for {} entries", kind, batchEntries.size(), e);
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

    private static <L> L requireListener(L listener) {
        if (listener == null) {
            throw new IllegalArgumentException("listener cannot be null");
        }
        return listener;
    }
}
