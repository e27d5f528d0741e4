/**
 * Jackson JSON codec adapter.
 *
 * <p><strong>Main Components:</strong></p>
 * <ul>
 *   <li>{@link com.ryuqq.execdb.adapter.jackson.JacksonCommandCodec}: order creation commands</li>
 *   <li>{@link com.ryuqq.execdb.adapter.jackson.JacksonEventCodec}: order, fill and account events</li>
 * </ul>
 *
 * <p>Encoding is deterministic for a given value. Malformed input raises
 * {@link com.ryuqq.execdb.core.exception.DeserializationException}.</p>
 *
 * @since 1.0.0
 * @author Execution Team
 */
package com.ryuqq.execdb.adapter.jackson;
