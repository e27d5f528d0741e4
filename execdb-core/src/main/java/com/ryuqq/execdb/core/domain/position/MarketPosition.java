package com.ryuqq.execdb.core.domain.position;

/**
 * 포지션 방향.
 *
 * @author Execution Team
 * @since 1.0.0
 */
public enum MarketPosition {
    FLAT,
    LONG,
    SHORT
}
