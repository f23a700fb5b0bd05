package com.ryuqq.atomicstore.core.exception;

/**
 * Unchecked failure raised by store infrastructure.
 *
 * <p>Used when a blocking operation is interrupted or a batch task fails.
 * Ordinary outcomes (missing key, existing key) are reported through return values,
 * never through this exception.</p>
 *
 * @author AtomicStore Team
 * @since 1.0.0
 */
public class AtomicStoreException extends RuntimeException {

    /**
     * @param message failure description
     */
    public AtomicStoreException(String message) {
        super(message);
    }

    /**
     * @param message failure description
     * @param cause underlying cause
     */
    public AtomicStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
