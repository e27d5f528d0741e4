package com.ryuqq.execdb.core.statemachine;

import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * 상태 집합 전이 검증 및 실행.
 *
 * <p><strong>허용되는 전이:</strong></p>
 * <ul>
 *   <li>WORKING → WORKING, WORKING → COMPLETED</li>
 *   <li>COMPLETED → COMPLETED</li>
 *   <li>OPEN → OPEN, OPEN → CLOSED</li>
 *   <li>CLOSED → CLOSED, CLOSED → OPEN</li>
 * </ul>
 *
 * <p>같은 상태로의 전이는 멤버십 재확인입니다. 계열 간 전이는 불가합니다.
 * 완료된 주문은 다시 작업 중이 될 수 없고, 청산된 포지션은 다시 열릴 수 있습니다.</p>
 *
 * @author Execution Team
 * @since 1.0.0
 */
public final class StatusTransition {

    private static final Map<IndexStatus, Set<IndexStatus>> ALLOWED = Map.of(
        IndexStatus.WORKING, EnumSet.of(IndexStatus.WORKING, IndexStatus.COMPLETED),
        IndexStatus.COMPLETED, EnumSet.of(IndexStatus.COMPLETED),
        IndexStatus.OPEN, EnumSet.of(IndexStatus.OPEN, IndexStatus.CLOSED),
        IndexStatus.CLOSED, EnumSet.of(IndexStatus.CLOSED, IndexStatus.OPEN)
    );

    private StatusTransition() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 전이가 유효한지 검증.
     *
     * @param from 현재 상태 집합
     * @param to 이동할 상태 집합
     * @throws IllegalArgumentException from 또는 to가 null인 경우
     * @throws IllegalStateException 유효하지 않은 전이인 경우
     */
    public static void validate(IndexStatus from, IndexStatus to) {
        if (from == null || to == null) {
            throw new IllegalArgumentException("States cannot be null (from: " + from + ", to: " + to + ")");
        }
        if (!ALLOWED.get(from).contains(to)) {
            throw new IllegalStateException(
                String.format("Invalid status transition: %s → %s", from, to)
            );
        }
    }

    /**
     * 전이 검증 후 이동 계획 반환.
     *
     * @param from 현재 상태 집합
     * @param to 이동할 상태 집합
     * @return 이동 계획
     * @throws IllegalArgumentException from 또는 to가 null인 경우
     * @throws IllegalStateException 유효하지 않은 전이인 경우
     */
    public static StatusMigration migrate(IndexStatus from, IndexStatus to) {
        validate(from, to);
        return StatusMigration.to(to);
    }
}
