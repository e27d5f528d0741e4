/**
 * 시작 시 잔여 상태 점검 패키지.
 *
 * <p>점검 결과는 진단 정보이며 예외로 전파되지 않습니다.</p>
 *
 * @since 1.0.0
 * @author Execution Team
 */
package com.ryuqq.execdb.application.residual;
