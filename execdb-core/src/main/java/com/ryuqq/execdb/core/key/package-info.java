/**
 * Key namespace derivation.
 *
 * <p>Every record and index of one trader lives under the {@code Trader-<traderId>} root.
 * {@link com.ryuqq.execdb.core.key.ExecutionKeys} is the only place key templates are built.</p>
 *
 * @since 1.0.0
 * @author Execution Team
 */
package com.ryuqq.execdb.core.key;
