/**
 * Unchecked exceptions raised by the execution database.
 *
 * @since 1.0.0
 * @author Execution Team
 */
package com.ryuqq.execdb.core.exception;
