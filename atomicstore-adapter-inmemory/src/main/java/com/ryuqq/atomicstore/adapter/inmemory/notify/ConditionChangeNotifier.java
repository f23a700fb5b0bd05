package com.ryuqq.atomicstore.adapter.inmemory.notify;

import com.ryuqq.atomicstore.core.cancel.CancellationToken;
import com.ryuqq.atomicstore.core.exception.AtomicStoreException;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * {@link ChangeNotifier} built on one {@link ReentrantLock} and one {@link Condition}.
 *
 * <p>The lock is the store lock: mutations run under it through {@link #runExclusive(Supplier)},
 * and waiters park on the condition it guards.</p>
 *
 * <p><strong>Cancellation Bridge:</strong></p>
 * <pre>
 * waitForDataChange(token)
 *   1. start helper thread: token.onCancel → complete woken(true)
 *   2. lock; if token not cancelled → changed.await()
 *   3. complete woken(false) (single-slot rendezvous), unlock
 *
 * helper
 *   - woken(false) first → close registration, exit
 *   - woken(true) first  → close registration; lock; changed.signalAll(); unlock
 * </pre>
 *
 * <p>The helper always closes its token registration, so a token reused across many
 * notified waits keeps no callback from waits that already returned.</p>
 *
 * <p>A cancellation wakes every waiter, not only the cancelled one. Both that and
 * {@link Condition#await()}'s own spurious wakeups are valid: callers re-check their
 * condition after returning.</p>
 *
 * @author AtomicStore Team
 * @since 1.0.0
 */
public final class ConditionChangeNotifier implements ChangeNotifier {

    private final ReentrantLock lock;
    private final Condition changed;
    private final ThreadFactory helperThreads;

    /**
     * @param helperThreads factory for cancellation helper threads
     * @throws IllegalArgumentException if helperThreads is null
     */
    public ConditionChangeNotifier(ThreadFactory helperThreads) {
        if (helperThreads == null) {
            throw new IllegalArgumentException("helperThreads cannot be null");
        }
        this.lock = new ReentrantLock();
        this.changed = lock.newCondition();
        this.helperThreads = helperThreads;
    }

    @Override
    public <T> T runExclusive(Supplier<T> action) {
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void notifyDidChange() {
        lock.lock();
        try {
            changed.signalAll();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void waitForDataChange(CancellationToken token) {
        if (token.isCancelled()) {
            return;
        }

        CompletableFuture<Boolean> woken = new CompletableFuture<>();
        helperThreads.newThread(() -> bridgeCancellation(token, woken)).start();

        lock.lock();
        try {
            // The helper broadcasts under this lock, so a cancellation either lands
            // before this check or after await() has released the lock.
            if (!token.isCancelled()) {
                changed.await();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AtomicStoreException("Interrupted while waiting for data change", e);
        } finally {
            woken.complete(Boolean.FALSE);
            lock.unlock();
        }
    }

    @Override
    public boolean isLockable() {
        return true;
    }

    @Override
    public int waitingThreads() {
        lock.lock();
        try {
            return lock.getWaitQueueLength(changed);
        } finally {
            lock.unlock();
        }
    }

    private void bridgeCancellation(CancellationToken token, CompletableFuture<Boolean> woken) {
        boolean cancelled;
        try (CancellationToken.Registration registration = token.onCancel(() -> woken.complete(Boolean.TRUE))) {
            cancelled = woken.join();
        }
        if (cancelled) {
            notifyDidChange();
        }
    }
}
