package kr.jemi.boxoffice.hold.infrastructure.in.web.dto;

import kr.jemi.boxoffice.hold.domain.Hold;

import java.time.Instant;
import java.util.List;

public record HoldResponse(String holdToken, long showId, List<String> seatIds, Instant expiresAt) {

    public static HoldResponse from(Hold hold) {
        return new HoldResponse(hold.token(), hold.showId(), hold.seatIds(), hold.expiresAt());
    }
}
