/**
 * Immutable result types returned by store and batch operations.
 *
 * <h2>Value Objects</h2>
 * <ul>
 *   <li>{@link com.ryuqq.atomicstore.core.model.InsertResult} - Value after an insert and whether the key existed</li>
 *   <li>{@link com.ryuqq.atomicstore.core.model.BatchResult} - Aggregated created/updated/deleted sets of one batch</li>
 * </ul>
 *
 * <h2>Design Principles</h2>
 * <ul>
 *   <li><strong>Immutability:</strong> Records with defensive copies</li>
 *   <li><strong>Validation:</strong> Compact constructors reject nulls</li>
 *   <li><strong>Pure Java:</strong> No external dependencies</li>
 * </ul>
 *
 * @since 1.0.0
 * @author AtomicStore Team
 */
package com.ryuqq.atomicstore.core.model;
