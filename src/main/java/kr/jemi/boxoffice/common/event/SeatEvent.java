package kr.jemi.boxoffice.common.event;

import java.time.Instant;
import java.util.List;

public interface SeatEvent {

    String eventType();

    long showId();

    List<String> seatIds();

    Instant occurredAt();

    default Long bookingId() {
        return null;
    }
}
