package com.ryuqq.atomicstore.testkit.contract;

import com.ryuqq.atomicstore.core.cancel.CancellationToken;
import com.ryuqq.atomicstore.core.model.InsertResult;
import com.ryuqq.atomicstore.core.spi.AtomicStore;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Random;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract Test for single-key store semantics.
 *
 * <p><strong>Test Scenarios:</strong></p>
 * <ul>
 *   <li>insert / insertUnique / remove / get return values</li>
 *   <li>size() tracks the key count (single-threaded and concurrent)</li>
 *   <li>flush() empties the store through the remove path</li>
 *   <li>Entry listeners fire once per effective mutation, never for no-ops</li>
 *   <li>Listener failures and listener re-entry never escape or deadlock</li>
 *   <li>Non-lockable stores skip notification</li>
 * </ul>
 *
 * @author AtomicStore Team
 * @since 1.0.0
 */
public abstract class StoreContractTest extends AbstractContractTest {

    @Test
    void testInsertThenOverwrite_ReturnsWrittenValueAndExistence() {
        // When & Then
        assertEquals(new InsertResult<>(1, false), store.insert("k", 1));
        assertEquals(new InsertResult<>(2, true), store.insert("k", 2));
        assertEquals(Optional.of(2), store.get("k"));
        assertTrue(store.remove("k"));
        assertEquals(Optional.empty(), store.get("k"));
        assertEquals(0, store.size());
    }

    @Test
    void testInsertUnique_ExistingKey_KeepsFirstValue() {
        // Given
        assertEquals(InsertResult.created(1), store.insertUnique("k", 1));

        // When
        InsertResult<Integer> second = store.insertUnique("k", 2);

        // Then
        assertEquals(InsertResult.existing(1), second);
        assertEquals(Optional.of(1), store.get("k"));
        assertEquals(1, store.size());
    }

    @Test
    void testRemove_AbsentKey_ReturnsFalseWithoutEffect() {
        // Given
        store.insert("present", 1);

        // When & Then
        assertFalse(store.remove("absent"));
        assertEquals(1, store.size());
        assertEquals(Set.of("present"), store.keySnapshot());
    }

    @Test
    void testSize_RandomSingleThreadedSequence_MatchesKeyCount() {
        // Given: fixed seed for a reproducible sequence
        Random random = new Random(42);
        Set<String> expected = new HashSet<>();

        // When
        for (int i = 0; i < 2_000; i++) {
            String key = "key-" + random.nextInt(100);
            switch (random.nextInt(3)) {
                case 0 -> {
                    store.insert(key, i);
                    expected.add(key);
                }
                case 1 -> {
                    store.insertUnique(key, i);
                    expected.add(key);
                }
                default -> {
                    assertEquals(expected.remove(key), store.remove(key));
                }
            }

            // Then: invariant holds after every step
            assertEquals(expected.size(), store.size());
        }
        assertEquals(expected, store.keySnapshot());
    }

    @Test
    void testFlush_PopulatedStore_LeavesStoreEmpty() {
        // Given
        for (int i = 0; i < 50; i++) {
            store.insert("key-" + i, i);
        }
        List<String> removedKeys = new CopyOnWriteArrayList<>();
        store.onRemove((key, value) -> removedKeys.add(key));

        // When
        store.flush();

        // Then
        assertEquals(0, store.size());
        assertTrue(store.keySnapshot().isEmpty());
        assertEquals(50, removedKeys.size());
    }

    @Test
    void testKeySnapshot_LaterMutations_DoNotAffectSnapshot() {
        // Given
        store.insert("a", 1);
        Set<String> snapshot = store.keySnapshot();

        // When
        store.insert("b", 2);

        // Then
        assertEquals(Set.of("a"), snapshot);
        assertThatThrownBy(() -> snapshot.add("c")).isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void testEntryListeners_FireForEffectiveMutationsOnly() {
        // Given
        List<String> events = new CopyOnWriteArrayList<>();
        store.onInsert((key, value) -> events.add("insert:" + key + "=" + value));
        store.onUpdate((key, value) -> events.add("update:" + key + "=" + value));
        store.onRemove((key, value) -> events.add("remove:" + key + "=" + value));

        // When
        store.insert("k", 1);
        store.insert("k", 2);
        store.insertUnique("k", 3);
        store.insertUnique("u", 4);
        store.remove("k");
        store.remove("k");

        // Then
        assertEquals(List.of("insert:k=1", "update:k=2", "insert:u=4", "remove:k=2"), events);
    }

    @Test
    void testListenerReplacement_OnlyLatestListenerFires() {
        // Given
        List<String> first = new ArrayList<>();
        List<String> second = new ArrayList<>();
        store.onInsert((key, value) -> first.add(key));
        store.onInsert((key, value) -> second.add(key));

        // When
        store.insert("k", 1);

        // Then
        assertTrue(first.isEmpty());
        assertEquals(List.of("k"), second);
    }

    @Test
    void testListenerException_MutationAppliedAndNotPropagated() {
        // Given
        store.onInsert((key, value) -> {
            throw new IllegalStateException("listener failure");
        });

        // When
        InsertResult<Integer> result = store.insert("k", 1);

        // Then
        assertEquals(InsertResult.created(1), result);
        assertEquals(1, store.size());
        // The lock must have been released: another mutation completes
        assertTimeoutPreemptively(Duration.ofSeconds(5), () -> store.insert("other", 2));
    }

    @Test
    void testListenerReentry_MutationRejectedWithoutDeadlock() {
        // Given
        AtomicReference<RuntimeException> rejection = new AtomicReference<>();
        store.onInsert((key, value) -> {
            try {
                store.insert(key + "-nested", value);
            } catch (RuntimeException e) {
                rejection.set(e);
            }
        });

        // When
        assertTimeoutPreemptively(Duration.ofSeconds(5), () -> store.insert("k", 1));

        // Then
        assertThat(rejection.get()).isInstanceOf(IllegalStateException.class);
        assertEquals(Set.of("k"), store.keySnapshot());
        assertEquals(1, store.size());
    }

    @Test
    void testNullArguments_Rejected() {
        assertThrows(IllegalArgumentException.class, () -> store.insert(null, 1));
        assertThrows(IllegalArgumentException.class, () -> store.insert("k", null));
        assertThrows(IllegalArgumentException.class, () -> store.insertUnique("k", null));
        assertThrows(IllegalArgumentException.class, () -> store.remove(null));
        assertThrows(IllegalArgumentException.class, () -> store.get(null));
        assertThrows(IllegalArgumentException.class, () -> store.onInsert(null));
        assertThrows(IllegalArgumentException.class, () -> store.onBatchRemove(null));
        assertThrows(IllegalArgumentException.class, () -> store.waitForDataChange(null));
        assertEquals(0, store.size());
    }

    @Test
    void testConcurrentMutations_Lockable_SizeMatchesKeys() throws Exception {
        assertConcurrentMutationsKeepCount(store);
    }

    @Test
    void testConcurrentMutations_NonLockable_SizeMatchesKeys() throws Exception {
        assertConcurrentMutationsKeepCount(createStore(false));
    }

    @Test
    void testNonLockable_NotificationIsNoOp() {
        // Given
        AtomicStore<Integer> nonLockable = createStore(false);

        // When & Then
        assertFalse(nonLockable.isLockable());
        assertTimeoutPreemptively(Duration.ofSeconds(5), () -> {
            nonLockable.notifyDidChange();
            nonLockable.waitForDataChange(CancellationToken.create());
        });
    }

    @Test
    void testWaitForDataChange_AlreadyCancelledToken_ReturnsPromptly() {
        assertTrue(store.isLockable());
        assertTimeoutPreemptively(Duration.ofSeconds(5),
                () -> store.waitForDataChange(CancellationToken.cancelled()));
    }

    @Test
    void testWaitForDataChange_TokenCancelledLater_Returns() {
        // Given
        CancellationToken token = CancellationToken.create().cancelAfter(Duration.ofMillis(100));

        // When & Then
        assertTimeoutPreemptively(Duration.ofSeconds(5), () -> store.waitForDataChange(token));
        assertTrue(token.isCancelled());
    }

    private void assertConcurrentMutationsKeepCount(AtomicStore<Integer> target) throws Exception {
        int threadCount = 8;
        int opsPerThread = 500;
        CountDownLatch start = new CountDownLatch(1);
        ExecutorService executorService = Executors.newFixedThreadPool(threadCount);
        List<Future<?>> futures = new ArrayList<>();

        for (int t = 0; t < threadCount; t++) {
            int seed = t;
            futures.add(executorService.submit(() -> {
                Random random = new Random(seed);
                start.await();
                for (int i = 0; i < opsPerThread; i++) {
                    String key = "key-" + random.nextInt(64);
                    switch (random.nextInt(3)) {
                        case 0 -> target.insert(key, i);
                        case 1 -> target.insertUnique(key, i);
                        default -> target.remove(key);
                    }
                }
                return null;
            }));
        }

        start.countDown();
        for (Future<?> future : futures) {
            future.get(30, TimeUnit.SECONDS);
        }
        executorService.shutdown();

        assertSizeMatchesKeys(target);
    }
}
