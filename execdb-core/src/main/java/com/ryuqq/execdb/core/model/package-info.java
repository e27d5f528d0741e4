/**
 * 식별자 Value Object 패키지.
 *
 * <p>모든 식별자는 {@link com.ryuqq.execdb.core.model.Identifier}를 상속하며
 * 정적 팩토리 {@code of(String)}로 생성합니다.</p>
 *
 * @since 1.0.0
 * @author Execution Team
 */
package com.ryuqq.execdb.core.model;
