package kr.jemi.boxoffice.common.event;

import java.time.Instant;
import java.util.List;

public record SeatsHeldEvent(long showId, List<String> seatIds, String holdToken,
                             Instant occurredAt) implements SeatEvent {

    public SeatsHeldEvent {
        seatIds = List.copyOf(seatIds);
    }

    @Override
    public String eventType() {
        return "SeatsHeld";
    }
}
