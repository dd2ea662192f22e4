package kr.jemi.boxoffice.show.domain;

public enum SeatAvailability {
    AVAILABLE,
    HELD,
    BOOKED
}
