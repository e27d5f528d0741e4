package com.ryuqq.execdb.core.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 식별자 Value Object 테스트.
 *
 * @author Execution Team
 * @since 1.0.0
 */
class IdentifierTest {

    @Test
    void of_ValidValue_CreatesIdentifier() {
        // When
        ClientOrderId clOrdId = ClientOrderId.of("O-19700101-000000-001-001-1");

        // Then
        assertEquals("O-19700101-000000-001-001-1", clOrdId.getValue());
    }

    @Test
    void of_NullValue_ThrowsException() {
        IllegalArgumentException exception = assertThrows(
            IllegalArgumentException.class,
            () -> PositionId.of(null)
        );
        assertTrue(exception.getMessage().contains("cannot be null"));
    }

    @Test
    void of_BlankValue_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> StrategyId.of("   "));
    }

    @Test
    void of_ValueWithColon_ThrowsException() {
        IllegalArgumentException exception = assertThrows(
            IllegalArgumentException.class,
            () -> AccountId.of("FXCM:D102851000")
        );
        assertTrue(exception.getMessage().contains("':'"));
    }

    @Test
    void of_TooLongValue_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> ClientOrderId.of("O".repeat(256)));
    }

    @Test
    void equals_SameTypeAndValue_AreEqual() {
        assertEquals(ClientOrderId.of("O-1"), ClientOrderId.of("O-1"));
        assertEquals(ClientOrderId.of("O-1").hashCode(), ClientOrderId.of("O-1").hashCode());
    }

    @Test
    void equals_DifferentTypeSameValue_AreNotEqual() {
        assertNotEquals(ClientOrderId.of("X-1"), PositionId.of("X-1"));
    }

    @Test
    void traderId_NameTagFormat_SplitsParts() {
        // When
        TraderId traderId = TraderId.of("TESTER-000");

        // Then
        assertEquals("TESTER", traderId.name());
        assertEquals("000", traderId.tag());
        assertEquals(traderId, TraderId.of("TESTER", "000"));
    }

    @Test
    void traderId_MissingTag_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> TraderId.of("TESTER"));
        assertThrows(IllegalArgumentException.class, () -> TraderId.of("TESTER-"));
    }
}
