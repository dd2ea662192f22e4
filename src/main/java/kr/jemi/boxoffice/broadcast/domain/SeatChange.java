package kr.jemi.boxoffice.broadcast.domain;

import kr.jemi.boxoffice.common.event.SeatEvent;

import java.time.Instant;
import java.util.List;

public record SeatChange(String eventType, long showId, List<String> seatIds, Long bookingId, Instant occurredAt) {

    public SeatChange {
        seatIds = List.copyOf(seatIds);
    }

    public static SeatChange from(SeatEvent event) {
        return new SeatChange(event.eventType(), event.showId(), event.seatIds(),
                event.bookingId(), event.occurredAt());
    }
}
