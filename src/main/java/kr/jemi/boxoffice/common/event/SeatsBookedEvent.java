package kr.jemi.boxoffice.common.event;

import java.time.Instant;
import java.util.List;

public record SeatsBookedEvent(long showId, List<String> seatIds, Long bookingId,
                               String bookingCode, Instant occurredAt) implements SeatEvent {

    public SeatsBookedEvent {
        seatIds = List.copyOf(seatIds);
    }

    @Override
    public String eventType() {
        return "SeatsBooked";
    }
}
