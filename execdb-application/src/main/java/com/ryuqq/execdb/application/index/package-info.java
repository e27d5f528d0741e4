/**
 * 주문/포지션/전략 관계 인덱스 패키지.
 *
 * @since 1.0.0
 * @author Execution Team
 */
package com.ryuqq.execdb.application.index;
