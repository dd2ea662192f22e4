package kr.jemi.boxoffice.seat.api;

import java.util.List;

public record SeatReservation(boolean reserved, List<String> conflictedSeatIds) {

    public SeatReservation {
        conflictedSeatIds = List.copyOf(conflictedSeatIds);
    }
}
