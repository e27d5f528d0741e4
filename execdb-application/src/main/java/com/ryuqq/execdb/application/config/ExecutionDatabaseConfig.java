package com.ryuqq.execdb.application.config;

import com.ryuqq.execdb.core.model.TraderId;

/**
 * Execution Database 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>traderId: 키 네임스페이스 루트 (필수)</li>
 *   <li>bulkLoadPolicy: 일괄 로드 중 손상 레코드 처리 (기본 SKIP)</li>
 *   <li>pruneStrategyIndicesOnDelete: deleteStrategy 시 strategy→orders / strategy→positions
 *       인덱스도 삭제할지 여부 (기본 false, 레지스트리에서만 제거)</li>
 * </ul>
 *
 * @author Execution Team
 * @since 1.0.0
 * @param traderId Trader ID (null이 아니어야 함)
 * @param bulkLoadPolicy 일괄 로드 정책 (null이 아니어야 함)
 * @param pruneStrategyIndicesOnDelete 전략 삭제 시 전략 인덱스 정리 여부
 */
public record ExecutionDatabaseConfig(
    TraderId traderId,
    BulkLoadPolicy bulkLoadPolicy,
    boolean pruneStrategyIndicesOnDelete
) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: bulkLoadPolicy=SKIP, pruneStrategyIndicesOnDelete=false</p>
     *
     * @param traderId Trader ID
     */
    public ExecutionDatabaseConfig(TraderId traderId) {
        this(traderId, BulkLoadPolicy.SKIP, false);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public ExecutionDatabaseConfig {
        if (traderId == null) {
            throw new IllegalArgumentException("traderId cannot be null");
        }
        if (bulkLoadPolicy == null) {
            throw new IllegalArgumentException("bulkLoadPolicy cannot be null");
        }
    }

    /**
     * bulkLoadPolicy만 변경한 새 인스턴스 생성.
     */
    public ExecutionDatabaseConfig withBulkLoadPolicy(BulkLoadPolicy bulkLoadPolicy) {
        return new ExecutionDatabaseConfig(traderId, bulkLoadPolicy, pruneStrategyIndicesOnDelete);
    }

    /**
     * pruneStrategyIndicesOnDelete만 변경한 새 인스턴스 생성.
     */
    public ExecutionDatabaseConfig withPruneStrategyIndicesOnDelete(boolean pruneStrategyIndicesOnDelete) {
        return new ExecutionDatabaseConfig(traderId, bulkLoadPolicy, pruneStrategyIndicesOnDelete);
    }
}
