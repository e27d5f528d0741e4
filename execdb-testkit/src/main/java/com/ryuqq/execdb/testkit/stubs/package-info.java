/**
 * 테스트용 식별자, 이벤트, 주문 생성기.
 *
 * @author Execution Team
 * @since 1.0.0
 */
package com.ryuqq.execdb.testkit.stubs;
