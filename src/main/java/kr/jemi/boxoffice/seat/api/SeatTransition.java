package kr.jemi.boxoffice.seat.api;

public enum SeatTransition {
    APPLIED,
    EXPIRED,
    NOT_FOUND
}
