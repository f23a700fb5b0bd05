/**
 * Cancellation signal accepted by blocking store operations.
 *
 * @since 1.0.0
 * @author AtomicStore Team
 */
package com.ryuqq.atomicstore.core.cancel;
