/**
 * In-memory store adapter: counted key-value store and concurrent batch executor.
 *
 * <p>This package contains the reference implementation of the
 * {@link com.ryuqq.atomicstore.core.spi.AtomicStore} and {@link com.ryuqq.atomicstore.core.spi.Batch}
 * SPI interfaces.</p>
 *
 * <h2>Architecture</h2>
 * <ul>
 *   <li><strong>Entries:</strong> {@link java.util.concurrent.ConcurrentHashMap} key → value</li>
 *   <li><strong>Count:</strong> {@link com.ryuqq.atomicstore.core.counter.AtomicCounter}, updated with the map</li>
 *   <li><strong>Lock and notification:</strong> {@link com.ryuqq.atomicstore.adapter.inmemory.notify.ChangeNotifier}</li>
 *   <li><strong>Batch workers:</strong> fixed thread pool per execution, sized min(jobs, batchConcurrency)</li>
 * </ul>
 *
 * <h2>Limitations</h2>
 * <ul>
 *   <li><strong>In-Memory Only:</strong> Data lost on process restart</li>
 *   <li><strong>Single JVM:</strong> No cross-process sharing</li>
 *   <li><strong>Coarse Lock:</strong> One mutation at a time in lockable mode</li>
 * </ul>
 *
 * @see com.ryuqq.atomicstore.adapter.inmemory.store.InMemoryAtomicStore
 * @author AtomicStore Team
 * @since 1.0.0
 */
package com.ryuqq.atomicstore.adapter.inmemory.store;
