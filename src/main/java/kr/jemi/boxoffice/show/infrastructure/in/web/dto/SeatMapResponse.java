package kr.jemi.boxoffice.show.infrastructure.in.web.dto;

import kr.jemi.boxoffice.show.domain.SeatMap;

import java.math.BigDecimal;
import java.util.List;

public record SeatMapResponse(long showId, List<SeatResponse> seats) {

    public record SeatResponse(String seatId, String tier, BigDecimal price, String status) {
    }

    public static SeatMapResponse from(SeatMap seatMap) {
        return new SeatMapResponse(seatMap.showId(), seatMap.seats().stream()
                .map(entry -> new SeatResponse(entry.seatId(), entry.tier(), entry.price(),
                        entry.availability().name()))
                .toList());
    }
}
