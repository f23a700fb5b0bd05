package com.ryuqq.atomicstore.adapter.inmemory.notify;

import com.ryuqq.atomicstore.core.cancel.CancellationToken;

import java.util.function.Supplier;

/**
 * No-op {@link ChangeNotifier} for non-lockable stores.
 *
 * <p>Mutations run without a store lock, relying on the backing map's own atomic
 * operations. Waiting returns immediately and notifications are dropped.</p>
 *
 * @author AtomicStore Team
 * @since 1.0.0
 */
public final class NoOpChangeNotifier implements ChangeNotifier {

    public static final NoOpChangeNotifier INSTANCE = new NoOpChangeNotifier();

    private NoOpChangeNotifier() {
    }

    @Override
    public <T> T runExclusive(Supplier<T> action) {
        return action.get();
    }

    @Override
    public void notifyDidChange() {
        // No-op: nothing can be waiting
    }

    @Override
    public void waitForDataChange(CancellationToken token) {
        // No-op: returns immediately
    }

    @Override
    public boolean isLockable() {
        return false;
    }

    @Override
    public int waitingThreads() {
        return 0;
    }
}
