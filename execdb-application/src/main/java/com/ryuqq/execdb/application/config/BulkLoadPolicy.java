package com.ryuqq.execdb.application.config;

/**
 * 일괄 로드 중 손상된 레코드 처리 정책.
 *
 * <ul>
 *   <li>SKIP: 손상된 레코드를 ERROR 로그로 남기고 결과에서 제외, 나머지는 계속 로드</li>
 *   <li>ABORT: 첫 번째 실패를 그대로 호출자에게 전파</li>
 * </ul>
 *
 * <p>어느 정책이든 저장소 연결 실패는 항상 전파됩니다.</p>
 *
 * @author Execution Team
 * @since 1.0.0
 */
public enum BulkLoadPolicy {

    SKIP,

    ABORT
}
