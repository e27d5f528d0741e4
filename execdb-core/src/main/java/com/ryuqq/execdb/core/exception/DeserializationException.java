package com.ryuqq.execdb.core.exception;

/**
 * Raised when stored bytes cannot be decoded into the expected command or event.
 *
 * <p>Fatal to reconstructing the record being read. Codecs must raise this
 * instead of returning a default value.</p>
 *
 * @author Execution Team
 * @since 1.0.0
 */
public class DeserializationException extends ExecutionStoreException {

    public DeserializationException(String message) {
        super(message);
    }

    public DeserializationException(String message, Throwable cause) {
        super(message, cause);
    }
}
