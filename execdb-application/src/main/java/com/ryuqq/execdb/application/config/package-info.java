/**
 * Execution Database 설정 패키지.
 *
 * @since 1.0.0
 * @author Execution Team
 */
package com.ryuqq.execdb.application.config;
