package com.ryuqq.atomicstore.core.spi;

import com.ryuqq.atomicstore.core.cancel.CancellationToken;
import com.ryuqq.atomicstore.core.model.InsertResult;

import java.util.Optional;
import java.util.Set;

/**
 * Thread-safe key-value store SPI with live counting, change notification and batching.
 *
 * <p>This interface describes an in-memory associative container whose element count is
 * maintained exactly alongside mutations, whose observers can block until the contents
 * change, and whose mutations can be applied concurrently in batches.</p>
 *
 * <p><strong>Responsibilities:</strong></p>
 * <ul>
 *   <li>Single-key mutations (insert, insertUnique, remove) with per-entry listeners</li>
 *   <li>Non-mutating reads (get, keySnapshot, size)</li>
 *   <li>Store-wide change notification (notifyDidChange / waitForDataChange)</li>
 *   <li>Batch creation for concurrent multi-key mutation with aggregated listeners</li>
 * </ul>
 *
 * <p><strong>Lockable Mode:</strong></p>
 * <pre>
 * lockable = true  → one store-wide lock covers map update + counter update + listener call
 *                    notification primitives are active
 * lockable = false → no store lock; notifyDidChange / waitForDataChange are no-ops
 * </pre>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>Thread-safe: All methods must be safely callable from multiple threads</li>
 *   <li>size() equals the number of keys present after all completed mutations</li>
 *   <li>Reads do not need to take the store lock</li>
 *   <li>Listener exceptions must not escape while the store lock is held</li>
 * </ul>
 *
 * @param <V> value type
 * @author AtomicStore Team
 * @since 1.0.0
 */
public interface AtomicStore<V> {

    /**
     * Writes {@code value} at {@code key}, overwriting any existing value.
     *
     * <p>Fires the update listener if the key existed, the insert listener otherwise.</p>
     *
     * @param key the key
     * @param value the value to store
     * @return the value written and whether the key existed before
     * @throws IllegalArgumentException if key or value is null
     * @throws IllegalStateException if called from an entry listener of this store
     */
    InsertResult<V> insert(String key, V value);

    /**
     * Writes {@code value} only when {@code key} is absent.
     *
     * <p>If the key exists, the existing value is returned unchanged with
     * {@code existed = true} and no listener fires.</p>
     *
     * @param key the key
     * @param value the value to store if absent
     * @return the resulting value and whether the key existed before
     * @throws IllegalArgumentException if key or value is null
     * @throws IllegalStateException if called from an entry listener of this store
     */
    InsertResult<V> insertUnique(String key, V value);

    /**
     * Removes {@code key} if present and fires the remove listener with the removed value.
     *
     * @param key the key
     * @return true if a value was removed, false if the key was absent
     * @throws IllegalArgumentException if key is null
     * @throws IllegalStateException if called from an entry listener of this store
     */
    boolean remove(String key);

    /**
     * Looks up the value mapped to {@code key}.
     *
     * @param key the key
     * @return the value, or empty if absent
     * @throws IllegalArgumentException if key is null
     */
    Optional<V> get(String key);

    /**
     * Returns a point-in-time copy of all keys.
     *
     * <p>The copy is not atomic with respect to concurrent mutations: keys written or
     * removed while the copy is built may or may not appear.</p>
     *
     * @return immutable set of keys
     */
    Set<String> keySnapshot();

    /**
     * @return the live number of keys
     */
    long size();

    /**
     * Removes every key one at a time, firing the remove listener for each,
     * then issues one change notification.
     *
     * @throws IllegalStateException if called from an entry listener of this store
     */
    void flush();

    /**
     * Wakes every thread currently blocked in {@link #waitForDataChange(CancellationToken)}.
     *
     * <p>No-op for non-lockable stores. Notifications are not buffered.</p>
     */
    void notifyDidChange();

    /**
     * Blocks until {@link #notifyDidChange()} is called or {@code token} is cancelled.
     *
     * <p>Returns immediately for non-lockable stores and for already-cancelled tokens.
     * Wakeups are store-wide and may be spurious; callers re-check their own condition.</p>
     *
     * @param token external cancellation signal
     * @throws IllegalArgumentException if token is null
     * @throws com.ryuqq.atomicstore.core.exception.AtomicStoreException if the waiting thread is interrupted
     */
    void waitForDataChange(CancellationToken token);

    /**
     * @return true if the store was created in lockable mode
     */
    boolean isLockable();

    /**
     * Creates a new single-use batch bound to this store.
     *
     * @return a new batch
     */
    Batch<V> batch();

    /**
     * Replaces the listener fired when a single insert creates a key.
     *
     * @param listener the listener
     * @throws IllegalArgumentException if listener is null
     */
    void onInsert(EntryListener<V> listener);

    /**
     * Replaces the listener fired when a single insert overwrites a key.
     *
     * @param listener the listener
     * @throws IllegalArgumentException if listener is null
     */
    void onUpdate(EntryListener<V> listener);

    /**
     * Replaces the listener fired when a single remove deletes a key.
     *
     * @param listener the listener
     * @throws IllegalArgumentException if listener is null
     */
    void onRemove(EntryListener<V> listener);

    /**
     * Replaces the listener fired once per batch with the created set.
     *
     * @param listener the listener
     * @throws IllegalArgumentException if listener is null
     */
    void onBatchInsert(BatchListener<V> listener);

    /**
     * Replaces the listener fired once per batch with the updated set.
     *
     * @param listener the listener
     * @throws IllegalArgumentException if listener is null
     */
    void onBatchUpdate(BatchListener<V> listener);

    /**
     * Replaces the listener fired once per batch with the deleted set.
     *
     * @param listener the listener
     * @throws IllegalArgumentException if listener is null
     */
    void onBatchRemove(BatchListener<V> listener);
}
