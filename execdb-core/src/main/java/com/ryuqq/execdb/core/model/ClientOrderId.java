package com.ryuqq.execdb.core.model;

/**
 * 클라이언트가 부여한 주문 식별자 (예: O-20200814-001-001-1).
 *
 * @author Execution Team
 * @since 1.0.0
 */
public final class ClientOrderId extends Identifier {

    private ClientOrderId(String value) {
        super(value);
    }

    /**
     * ClientOrderId 생성.
     *
     * @param value 식별자 값
     * @return ClientOrderId 인스턴스
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public static ClientOrderId of(String value) {
        return new ClientOrderId(value);
    }
}
