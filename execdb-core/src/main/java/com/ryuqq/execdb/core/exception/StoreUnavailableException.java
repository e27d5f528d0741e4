package com.ryuqq.execdb.core.exception;

/**
 * Raised when the backing record store cannot be reached.
 *
 * <p>A write that fails with this exception had no effect: write batches are
 * atomic, so callers never need to reason about partial application.
 * Reconnection is the caller's responsibility.</p>
 *
 * @author Execution Team
 * @since 1.0.0
 */
public class StoreUnavailableException extends ExecutionStoreException {

    public StoreUnavailableException(String message) {
        super(message);
    }

    public StoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
