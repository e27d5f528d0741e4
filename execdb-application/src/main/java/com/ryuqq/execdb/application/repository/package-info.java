/**
 * 엔티티 저장소 패키지.
 *
 * <p>주문과 포지션은 {@link com.ryuqq.execdb.application.repository.EventLogRepository} 하나로
 * 저장되고, 종류별 차이는 {@link com.ryuqq.execdb.application.repository.EntityKind} 구현
 * ({@link com.ryuqq.execdb.application.repository.OrderKind},
 * {@link com.ryuqq.execdb.application.repository.PositionKind})이 담당합니다.
 * 계좌는 스냅샷으로 저장됩니다 ({@link com.ryuqq.execdb.application.repository.AccountSnapshots}).</p>
 *
 * @since 1.0.0
 * @author Execution Team
 */
package com.ryuqq.execdb.application.repository;
