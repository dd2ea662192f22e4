package kr.jemi.boxoffice.broadcast.infrastructure.in.web.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import kr.jemi.boxoffice.broadcast.domain.SeatChange;

import java.time.Instant;
import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record SeatChangeMessage(String eventType, long showId, List<String> seatIds, Long bookingId, Instant timestamp) {

    public static SeatChangeMessage from(SeatChange change) {
        return new SeatChangeMessage(change.eventType(), change.showId(), change.seatIds(),
                change.bookingId(), change.occurredAt());
    }
}
