package com.ryuqq.execdb.core.model;

/**
 * Account 식별자 (예: FXCM-02851908-SIMULATED).
 *
 * @author Execution Team
 * @since 1.0.0
 */
public final class AccountId extends Identifier {

    private AccountId(String value) {
        super(value);
    }

    /**
     * AccountId 생성.
     *
     * @param value 식별자 값
     * @return AccountId 인스턴스
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public static AccountId of(String value) {
        return new AccountId(value);
    }
}
