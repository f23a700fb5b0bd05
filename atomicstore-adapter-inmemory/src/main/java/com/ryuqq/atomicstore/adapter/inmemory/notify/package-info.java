/**
 * Store lock and change broadcast for the in-memory adapter.
 *
 * <h2>Implementations</h2>
 * <ul>
 *   <li>{@link com.ryuqq.atomicstore.adapter.inmemory.notify.ConditionChangeNotifier} - Lockable mode:
 *       {@link java.util.concurrent.locks.ReentrantLock} + {@link java.util.concurrent.locks.Condition},
 *       with one helper thread per wait bridging external cancellation into a broadcast</li>
 *   <li>{@link com.ryuqq.atomicstore.adapter.inmemory.notify.NoOpChangeNotifier} - Non-lockable mode</li>
 * </ul>
 *
 * <h2>Wake Semantics</h2>
 * <ul>
 *   <li><strong>Store-wide:</strong> every notification wakes every current waiter</li>
 *   <li><strong>Unbuffered:</strong> a waiter arriving after a notification does not see it</li>
 *   <li><strong>Spurious wakeups:</strong> valid; callers re-check their own condition</li>
 * </ul>
 *
 * @since 1.0.0
 * @author AtomicStore Team
 */
package com.ryuqq.atomicstore.adapter.inmemory.notify;
