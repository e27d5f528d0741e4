package com.ryuqq.execdb.core.exception;

/**
 * Raised when a decoded event is rejected by the domain object during replay.
 *
 * <p>The log decoded cleanly but does not describe a valid history, e.g. a fill
 * recorded against an order that was never accepted.</p>
 *
 * @author Execution Team
 * @since 1.0.0
 */
public class ReplayException extends ExecutionStoreException {

    public ReplayException(String message, Throwable cause) {
        super(message, cause);
    }
}
