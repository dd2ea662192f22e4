package kr.jemi.boxoffice.booking.domain;

import java.time.Instant;
import java.util.List;

/**
 * 예매 제출 시점에 조회한 선점 정보.
 */
public record HeldSeats(String holdToken, long showId, List<String> seatIds, String actor, Instant expiresAt) {

    public HeldSeats {
        seatIds = List.copyOf(seatIds);
    }

    public boolean isExpiredAt(Instant now) {
        return !expiresAt.isAfter(now);
    }

    public boolean isOwnedBy(String actor) {
        return this.actor.equals(actor);
    }
}
