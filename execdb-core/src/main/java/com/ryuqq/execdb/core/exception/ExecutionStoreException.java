package com.ryuqq.execdb.core.exception;

/**
 * Base type for failures raised by the execution database and its collaborators.
 *
 * <p>All subtypes are unchecked. Absence of a record is never reported through
 * this hierarchy; loads return {@code Optional.empty()} instead.</p>
 *
 * @author Execution Team
 * @since 1.0.0
 */
public abstract class ExecutionStoreException extends RuntimeException {

    protected ExecutionStoreException(String message) {
        super(message);
    }

    protected ExecutionStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
