package kr.jemi.boxoffice.common.event;

import java.time.Instant;
import java.util.List;

public record SeatsReleasedEvent(long showId, List<String> seatIds, String holdToken,
                                 ReleaseReason reason, Instant occurredAt) implements SeatEvent {

    public SeatsReleasedEvent {
        seatIds = List.copyOf(seatIds);
    }

    @Override
    public String eventType() {
        return "SeatsReleased";
    }
}
