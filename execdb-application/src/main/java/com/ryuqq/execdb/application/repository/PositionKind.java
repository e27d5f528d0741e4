package com.ryuqq.execdb.application.repository;

import com.ryuqq.execdb.core.codec.EventCodec;
import com.ryuqq.execdb.core.domain.event.Event;
import com.ryuqq.execdb.core.domain.event.OrderFilled;
import com.ryuqq.execdb.core.domain.position.Position;
import com.ryuqq.execdb.core.exception.DeserializationException;
import com.ryuqq.execdb.core.exception.ReplayException;
import com.ryuqq.execdb.core.key.KeyKind;
import com.ryuqq.execdb.core.model.PositionId;
import com.ryuqq.execdb.core.statemachine.IndexStatus;

import java.util.ArrayList;
import java.util.List;

/**
 * 포지션 로그 정의.
 *
 * <p>항목 0은 개설 체결, 항목 1..n은 이후 체결입니다.</p>
 *
 * @author Execution Team
 * @since 1.0.0
 */
public final class PositionKind implements EntityKind<PositionId, Position> {

    private final EventCodec eventCodec;

    public PositionKind(EventCodec eventCodec) {
        if (eventCodec == null) {
            throw new IllegalArgumentException("eventCodec cannot be null");
        }
        this.eventCodec = eventCodec;
    }

    @Override
    public String name() {
        return "position";
    }

    @Override
    public KeyKind logKind() {
        return KeyKind.POSITIONS;
    }

    @Override
    public KeyKind allIdsKind() {
        return KeyKind.INDEX_POSITIONS;
    }

    @Override
    public PositionId idOf(Position position) {
        return position.id();
    }

    @Override
    public PositionId parseId(String value) {
        return PositionId.of(value);
    }

    @Override
    public IndexStatus statusOf(Position position) {
        return position.isOpen() ? IndexStatus.OPEN : IndexStatus.CLOSED;
    }

    @Override
    public int logSize(Position position) {
        return position.eventCount();
    }

    @Override
    public List<byte[]> encodeFrom(Position position, int persisted) {
        List<OrderFilled> events = position.events();
        List<byte[]> entries = new ArrayList<>(Math.max(events.size() - persisted, 0));
        for (int i = persisted; i < events.size(); i++) {
            entries.add(eventCodec.encode(events.get(i)));
        }
        return entries;
    }

    @Override
    public Position replay(PositionId id, List<byte[]> entries) {
        Position position = null;
        for (int i = 0; i < entries.size(); i++) {
            Event event = eventCodec.decode(entries.get(i));
            if (!(event instanceof OrderFilled fill)) {
                throw new DeserializationException(
                    String.format("Position %s log entry %d is not a fill: %s",
                        id.getValue(), i, event.getClass().getSimpleName())
                );
            }
            try {
                if (position == null) {
                    position = Position.open(fill);
                } else {
                    position.apply(fill);
                }
            } catch (IllegalArgumentException | IllegalStateException e) {
                throw new ReplayException(
                    String.format("Position %s rejected log entry %d during replay", id.getValue(), i), e
                );
            }
        }
        if (!position.id().equals(id)) {
            throw new DeserializationException(
                String.format("Position %s log belongs to %s", id.getValue(), position.id().getValue())
            );
        }
        return position;
    }
}
