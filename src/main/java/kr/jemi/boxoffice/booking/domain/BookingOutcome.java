package kr.jemi.boxoffice.booking.domain;

public enum BookingOutcome {
    CONFIRMED,
    HOLD_EXPIRED,
    PAYMENT_FAILED,
    IN_PROGRESS
}
