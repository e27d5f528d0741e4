/**
 * Codec boundary between domain commands/events and stored bytes.
 *
 * <p>Implementations must be pure and deterministic, and must raise
 * {@link com.ryuqq.execdb.core.exception.DeserializationException} on malformed input.</p>
 *
 * @since 1.0.0
 * @author Execution Team
 */
package com.ryuqq.execdb.core.codec;
