package com.ryuqq.atomicstore.adapter.inmemory.notify;

import com.ryuqq.atomicstore.core.cancel.CancellationToken;

import java.util.function.Supplier;

/**
 * Store-wide mutual exclusion and change broadcast.
 *
 * <p>A lockable store holds a {@link ConditionChangeNotifier}; a non-lockable store holds
 * {@link NoOpChangeNotifier#INSTANCE}, for which every method degrades to a direct call or
 * a no-op.</p>
 *
 * @author AtomicStore Team
 * @since 1.0.0
 */
public interface ChangeNotifier {

    /**
     * Runs {@code action} under the store lock.
     *
     * @param action mutation to run
     * @param <T> result type
     * @return the action's result
     */
    <T> T runExclusive(Supplier<T> action);

    /**
     * Wakes every thread blocked in {@link #waitForDataChange(CancellationToken)}.
     */
    void notifyDidChange();

    /**
     * Blocks until {@link #notifyDidChange()} or cancellation of {@code token}.
     *
     * @param token external cancellation signal
     */
    void waitForDataChange(CancellationToken token);

    /**
     * @return true if this notifier provides locking and blocking
     */
    boolean isLockable();

    /**
     * @return number of threads currently blocked in {@link #waitForDataChange(CancellationToken)}
     */
    int waitingThreads();
}
