package com.ryuqq.execdb.application.repository;

import com.ryuqq.execdb.core.codec.CommandCodec;
import com.ryuqq.execdb.core.codec.EventCodec;
import com.ryuqq.execdb.core.domain.event.AccountState;
import com.ryuqq.execdb.core.domain.order.Order;
import com.ryuqq.execdb.core.exception.DeserializationException;
import com.ryuqq.execdb.core.exception.ReplayException;
import com.ryuqq.execdb.core.model.ClientOrderId;
import com.ryuqq.execdb.core.statemachine.IndexStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

import static com.ryuqq.execdb.application.Fixtures.ACCOUNT_ID;
import static com.ryuqq.execdb.application.Fixtures.accepted;
import static com.ryuqq.execdb.application.Fixtures.marketOrder;
import static com.ryuqq.execdb.application.Fixtures.submitted;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.when;

/**
 * OrderKind 테스트.
 *
 * @author Execution Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class OrderKindTest {

    private static final byte[] ENTRY_0 = {0};
    private static final byte[] ENTRY_1 = {1};
    private static final byte[] ENTRY_2 = {2};

    @Mock
    private CommandCodec commandCodec;

    @Mock
    private EventCodec eventCodec;

    private OrderKind kind;

    @BeforeEach
    void setUp() {
        kind = new OrderKind(commandCodec, eventCodec);
    }

    @Test
    void replay_CommandThenEvents_RebuildsEqualOrder() {
        // given
        Order expected = marketOrder("O-1");
        expected.apply(submitted(expected));
        expected.apply(accepted(expected));
        when(commandCodec.decode(ENTRY_0)).thenReturn(expected.initCommand());
        when(eventCodec.decode(ENTRY_1)).thenReturn(expected.events().get(0));
        when(eventCodec.decode(ENTRY_2)).thenReturn(expected.events().get(1));

        // when
        Order replayed = kind.replay(ClientOrderId.of("O-1"), List.of(ENTRY_0, ENTRY_1, ENTRY_2));

        // then
        assertThat(replayed).isEqualTo(expected);
        assertThat(kind.logSize(replayed)).isEqualTo(3);
        assertThat(kind.statusOf(replayed)).isEqualTo(IndexStatus.WORKING);
    }

    @Test
    void replay_EventRejectedByOrder_ThrowsReplayException() {
        // given: Submitted 없이 Accepted
        Order order = marketOrder("O-1");
        when(commandCodec.decode(ENTRY_0)).thenReturn(order.initCommand());
        when(eventCodec.decode(ENTRY_1)).thenReturn(accepted(order));

        // when & then
        assertThatThrownBy(() -> kind.replay(ClientOrderId.of("O-1"), List.of(ENTRY_0, ENTRY_1)))
            .isInstanceOf(ReplayException.class)
            .hasMessageContaining("O-1")
            .hasCauseInstanceOf(IllegalStateException.class);
    }

    @Test
    void replay_NonOrderEvent_ThrowsDeserializationException() {
        // given
        Order order = marketOrder("O-1");
        when(commandCodec.decode(ENTRY_0)).thenReturn(order.initCommand());
        when(eventCodec.decode(ENTRY_1)).thenReturn(new AccountState(
            ACCOUNT_ID, "USD", BigDecimal.ONE, BigDecimal.ONE, BigDecimal.ZERO, UUID.randomUUID(), Instant.EPOCH));

        // when & then
        assertThatThrownBy(() -> kind.replay(ClientOrderId.of("O-1"), List.of(ENTRY_0, ENTRY_1)))
            .isInstanceOf(DeserializationException.class)
            .hasMessageContaining("not an order event");
    }

    @Test
    void replay_CommandOfOtherOrder_ThrowsDeserializationException() {
        // given
        when(commandCodec.decode(ENTRY_0)).thenReturn(marketOrder("O-2").initCommand());

        // when & then
        assertThatThrownBy(() -> kind.replay(ClientOrderId.of("O-1"), List.of(ENTRY_0)))
            .isInstanceOf(DeserializationException.class);
    }

    @Test
    void encodeFrom_Persisted_SkipsStoredEntries() {
        // given
        Order order = marketOrder("O-1");
        order.apply(submitted(order));
        order.apply(accepted(order));
        when(eventCodec.encode(order.events().get(1))).thenReturn(ENTRY_2);

        // when
        List<byte[]> entries = kind.encodeFrom(order, 2);

        // then
        assertThat(entries).containsExactly(ENTRY_2);
    }
}
