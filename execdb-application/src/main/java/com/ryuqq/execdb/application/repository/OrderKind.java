package com.ryuqq.execdb.application.repository;

import com.ryuqq.execdb.core.codec.CommandCodec;
import com.ryuqq.execdb.core.codec.EventCodec;
import com.ryuqq.execdb.core.domain.command.Command;
import com.ryuqq.execdb.core.domain.command.CreateOrder;
import com.ryuqq.execdb.core.domain.event.Event;
import com.ryuqq.execdb.core.domain.event.OrderEvent;
import com.ryuqq.execdb.core.domain.order.Order;
import com.ryuqq.execdb.core.exception.DeserializationException;
import com.ryuqq.execdb.core.exception.ReplayException;
import com.ryuqq.execdb.core.key.KeyKind;
import com.ryuqq.execdb.core.model.ClientOrderId;
import com.ryuqq.execdb.core.statemachine.IndexStatus;

import java.util.ArrayList;
import java.util.List;

/**
 * 주문 로그 정의.
 *
 * <p>항목 0은 생성 명령 {@link CreateOrder}, 항목 1..n은 적용 순서대로의 {@link OrderEvent}입니다.</p>
 *
 * @author Execution Team
 * @since 1.0.0
 */
public final class OrderKind implements EntityKind<ClientOrderId, Order> {

    private final CommandCodec commandCodec;
    private final EventCodec eventCodec;

    public OrderKind(CommandCodec commandCodec, EventCodec eventCodec) {
        if (commandCodec == null) {
            throw new IllegalArgumentException("commandCodec cannot be null");
        }
        if (eventCodec == null) {
            throw new IllegalArgumentException("eventCodec cannot be null");
        }
        this.commandCodec = commandCodec;
        this.eventCodec = eventCodec;
    }

    @Override
    public String name() {
        return "order";
    }

    @Override
    public KeyKind logKind() {
        return KeyKind.ORDERS;
    }

    @Override
    public KeyKind allIdsKind() {
        return KeyKind.INDEX_ORDERS;
    }

    @Override
    public ClientOrderId idOf(Order order) {
        return order.clOrdId();
    }

    @Override
    public ClientOrderId parseId(String value) {
        return ClientOrderId.of(value);
    }

    @Override
    public IndexStatus statusOf(Order order) {
        return order.isCompleted() ? IndexStatus.COMPLETED : IndexStatus.WORKING;
    }

    @Override
    public int logSize(Order order) {
        return 1 + order.eventCount();
    }

    @Override
    public List<byte[]> encodeFrom(Order order, int persisted) {
        List<byte[]> entries = new ArrayList<>();
        if (persisted == 0) {
            entries.add(commandCodec.encode(order.initCommand()));
        }
        List<OrderEvent> events = order.events();
        for (int i = Math.max(persisted - 1, 0); i < events.size(); i++) {
            entries.add(eventCodec.encode(events.get(i)));
        }
        return entries;
    }

    @Override
    public Order replay(ClientOrderId id, List<byte[]> entries) {
        Command command = commandCodec.decode(entries.get(0));
        if (!(command instanceof CreateOrder create)) {
            throw new DeserializationException(
                String.format("Order %s log entry 0 is not a CreateOrder: %s",
                    id.getValue(), command.getClass().getSimpleName())
            );
        }
        if (!create.clOrdId().equals(id)) {
            throw new DeserializationException(
                String.format("Order %s log entry 0 belongs to %s", id.getValue(), create.clOrdId().getValue())
            );
        }

        Order order = Order.create(create);
        for (int i = 1; i < entries.size(); i++) {
            Event event = eventCodec.decode(entries.get(i));
            if (!(event instanceof OrderEvent orderEvent)) {
                throw new DeserializationException(
                    String.format("Order %s log entry %d is not an order event: %s",
                        id.getValue(), i, event.getClass().getSimpleName())
                );
            }
            try {
                order.apply(orderEvent);
            } catch (IllegalArgumentException | IllegalStateException e) {
                throw new ReplayException(
                    String.format("Order %s rejected log entry %d during replay", id.getValue(), i), e
                );
            }
        }
        return order;
    }
}
