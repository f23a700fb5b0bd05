/**
 * Concurrency-safe counting primitive backing the store's live element count.
 *
 * @since 1.0.0
 * @author AtomicStore Team
 */
package com.ryuqq.atomicstore.core.counter;
