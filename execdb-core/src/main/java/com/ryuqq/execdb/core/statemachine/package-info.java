/**
 * 상태 집합 State Machine 패키지.
 *
 * <p>주문(WORKING/COMPLETED)과 포지션(OPEN/CLOSED) 상태 인덱스의 이동 규칙을 정의합니다.</p>
 *
 * @since 1.0.0
 * @author Execution Team
 */
package com.ryuqq.execdb.core.statemachine;
