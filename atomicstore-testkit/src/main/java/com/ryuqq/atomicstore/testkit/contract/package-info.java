/**
 * Reusable contract tests for {@link com.ryuqq.atomicstore.core.spi.AtomicStore} implementations.
 *
 * <h2>Contract Tests</h2>
 * <ul>
 *   <li>{@link com.ryuqq.atomicstore.testkit.contract.StoreContractTest} - Single-key semantics, count, listeners</li>
 *   <li>{@link com.ryuqq.atomicstore.testkit.contract.BatchContractTest} - Batch classification and aggregated listeners</li>
 * </ul>
 *
 * <p>Adapters extend these classes in their own test sources and implement
 * {@link com.ryuqq.atomicstore.testkit.contract.AbstractContractTest#createStore(boolean)}.</p>
 *
 * @since 1.0.0
 * @author AtomicStore Team
 */
package com.ryuqq.atomicstore.testkit.contract;
