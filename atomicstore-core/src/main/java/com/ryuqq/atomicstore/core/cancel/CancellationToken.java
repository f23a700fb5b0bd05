package com.ryuqq.atomicstore.core.cancel;

import java.time.Duration;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * External cancellation signal for blocking waits.
 *
 * <p>A token starts uncancelled and may be cancelled exactly once; further
 * {@link #cancel()} calls are no-ops. Observers either poll {@link #isCancelled()}
 * or compose on {@link #asFuture()}.</p>
 *
 * <p>Long-lived tokens shared by repeated waits should be observed through
 * {@link #onCancel(Runnable)}: the returned {@link Registration} detaches the callback
 * when closed, so the token holds only callbacks of waits still in progress.
 * Futures returned by {@link #asFuture()} stay attached until cancellation.</p>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * CancellationToken token = CancellationToken.create().cancelAfter(Duration.ofSeconds(5));
 * store.waitForDataChange(token); // returns on change or after 5 seconds
 * </pre>
 *
 * @author AtomicStore Team
 * @since 1.0.0
 */
public final class CancellationToken {

    private final CompletableFuture<Void> cancelled;
    private final Set<Registration> registrations;

    private CancellationToken() {
        this.cancelled = new CompletableFuture<>();
        this.registrations = ConcurrentHashMap.newKeySet();
    }

    /**
     * Creates a token that has not been cancelled.
     *
     * @return a new token
     */
    public static CancellationToken create() {
        return new CancellationToken();
    }

    /**
     * Creates a token that is already cancelled.
     *
     * @return a cancelled token
     */
    public static CancellationToken cancelled() {
        CancellationToken token = new CancellationToken();
        token.cancel();
        return token;
    }

    /**
     * Cancels this token, releasing everything composed on {@link #asFuture()}.
     */
    public void cancel() {
        if (cancelled.complete(null)) {
            for (Registration registration : registrations) {
                registration.fire();
            }
        }
    }

    /**
     * Registers a callback run once when this token is cancelled.
     *
     * <p>If the token is already cancelled the callback runs immediately on the calling
     * thread. Otherwise it runs on the thread that calls {@link #cancel()}, so it must be
     * short and must not throw.</p>
     *
     * @param callback action to run on cancellation
     * @return registration that detaches the callback when closed
     * @throws IllegalArgumentException if callback is null
     */
    public Registration onCancel(Runnable callback) {
        if (callback == null) {
            throw new IllegalArgumentException("callback cannot be null");
        }
        Registration registration = new Registration(this, callback);
        registrations.add(registration);
        // cancel() may have iterated before the add above
        if (isCancelled()) {
            registration.fire();
        }
        return registration;
    }

    /**
     * Returns the number of callbacks still attached to this token.
     *
     * <p>This method is useful for testing and debugging.</p>
     *
     * @return attached callback count
     */
    public int registeredCallbacks() {
        return registrations.size();
    }

    /**
     * Schedules cancellation after the given delay.
     *
     * @param delay delay before cancellation
     * @return this token
     * @throws IllegalArgumentException if delay is null or negative
     */
    public CancellationToken cancelAfter(Duration delay) {
        if (delay == null) {
            throw new IllegalArgumentException("delay cannot be null");
        }
        if (delay.isNegative()) {
            throw new IllegalArgumentException("delay cannot be negative, but was: " + delay);
        }
        CompletableFuture.delayedExecutor(delay.toMillis(), TimeUnit.MILLISECONDS).execute(this::cancel);
        return this;
    }

    /**
     * @return true once {@link #cancel()} has been called
     */
    public boolean isCancelled() {
        return cancelled.isDone();
    }

    /**
     * Returns a future completed when this token is cancelled.
     *
     * <p>Each call returns a fresh copy, so completing or cancelling the returned
     * future does not affect the token. The copy stays attached to the token until it
     * is cancelled; repeated waits on a long-lived token use {@link #onCancel(Runnable)}.</p>
     *
     * @return future completed on cancellation
     */
    public CompletableFuture<Void> asFuture() {
        return cancelled.copy();
    }

    @Override
    public String toString() {
        return "CancellationToken{cancelled=" + isCancelled() + '}';
    }

    /**
     * Handle of a callback registered through {@link #onCancel(Runnable)}.
     *
     * <p>Closing is idempotent and never throws. A callback that already ran stays run.</p>
     */
    public static final class Registration implements AutoCloseable {

        private final CancellationToken token;
        private final Runnable callback;
        private final AtomicBoolean done = new AtomicBoolean();

        private Registration(CancellationToken token, Runnable callback) {
            this.token = token;
            this.callback = callback;
        }

        private void fire() {
            if (done.compareAndSet(false, true)) {
                token.registrations.remove(this);
                callback.run();
            }
        }

        @Override
        public void close() {
            done.set(true);
            token.registrations.remove(this);
        }
    }
}
