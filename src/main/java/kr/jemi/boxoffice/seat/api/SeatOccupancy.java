package kr.jemi.boxoffice.seat.api;

public enum SeatOccupancy {
    AVAILABLE,
    HELD,
    BOOKED
}
