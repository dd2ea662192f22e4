package kr.jemi.boxoffice.hold.api;

import java.time.Instant;
import java.util.List;

public record HoldView(String token, long showId, List<String> seatIds, String actor,
                       Instant createdAt, Instant expiresAt) {

    public HoldView {
        seatIds = List.copyOf(seatIds);
    }

    public boolean isExpiredAt(Instant now) {
        return !expiresAt.isAfter(now);
    }
}
