package kr.jemi.boxoffice.show.domain;

import java.math.BigDecimal;
import java.util.List;

public record SeatMap(long showId, List<Entry> seats) {

    public SeatMap {
        seats = List.copyOf(seats);
    }

    public record Entry(String seatId, String tier, BigDecimal price, SeatAvailability availability) {
    }
}
