/**
 * Execution Database 진입점 패키지.
 *
 * <p><strong>주요 컴포넌트:</strong></p>
 * <ul>
 *   <li>{@link com.ryuqq.execdb.application.database.ExecutionDatabase}: 호출자 대상 연산 집합</li>
 *   <li>{@link com.ryuqq.execdb.application.database.DefaultExecutionDatabase}: RecordStore + 코덱 기반 구현</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Execution Team
 */
package com.ryuqq.execdb.application.database;
