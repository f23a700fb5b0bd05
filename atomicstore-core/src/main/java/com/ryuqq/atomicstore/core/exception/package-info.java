/**
 * Exception types shared by store implementations.
 *
 * @since 1.0.0
 * @author AtomicStore Team
 */
package com.ryuqq.atomicstore.core.exception;
