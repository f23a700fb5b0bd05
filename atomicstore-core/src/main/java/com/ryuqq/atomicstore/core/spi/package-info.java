/**
 * Service Provider Interface (SPI) package.
 *
 * <p>This package defines the store contract implemented by adapter modules.</p>
 *
 * <h2>SPI Interfaces</h2>
 * <ul>
 *   <li>{@link com.ryuqq.atomicstore.core.spi.AtomicStore} - Counted, observable key-value store</li>
 *   <li>{@link com.ryuqq.atomicstore.core.spi.Batch} - Concurrent multi-key mutation</li>
 *   <li>{@link com.ryuqq.atomicstore.core.spi.EntryListener} - Per-entry insert/update/remove callback</li>
 *   <li>{@link com.ryuqq.atomicstore.core.spi.BatchListener} - Per-batch aggregated callback</li>
 * </ul>
 *
 * <h2>Implementation Responsibility</h2>
 * <p>Adapter layers (e.g., atomicstore-adapter-inmemory) provide concrete implementations,
 * and can verify them against the abstract contract tests in atomicstore-testkit.</p>
 *
 * @since 1.0.0
 * @author AtomicStore Team
 */
package com.ryuqq.atomicstore.core.spi;
