package kr.jemi.boxoffice.seat.domain;

public enum SeatStatus {
    AVAILABLE,
    HELD,
    BOOKED
}
