package com.ryuqq.execdb.core.statemachine;

/**
 * 상태 집합 이동 계획.
 *
 * <p>{@code target} 집합에 추가하고 {@code opposite} 집합에서 제거합니다.
 * 제거는 무조건 수행되며, 대상이 없어도 오류가 아닙니다.</p>
 *
 * @param target 추가할 상태 집합
 * @param opposite 제거할 상태 집합
 *
 * @author Execution Team
 * @since 1.0.0
 */
public record StatusMigration(
    IndexStatus target,
    IndexStatus opposite
) {

    public StatusMigration {
        if (target == null || opposite == null) {
            throw new IllegalArgumentException("target and opposite cannot be null");
        }
        if (target.opposite() != opposite) {
            throw new IllegalArgumentException(
                String.format("opposite must be %s for target %s (current: %s)", target.opposite(), target, opposite)
            );
        }
    }

    /**
     * target으로 이동하는 계획 생성.
     *
     * @param target 추가할 상태 집합
     * @return StatusMigration 인스턴스
     */
    public static StatusMigration to(IndexStatus target) {
        if (target == null) {
            throw new IllegalArgumentException("target cannot be null");
        }
        return new StatusMigration(target, target.opposite());
    }
}
