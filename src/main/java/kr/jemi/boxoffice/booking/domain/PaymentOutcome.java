package kr.jemi.boxoffice.booking.domain;

public enum PaymentOutcome {
    SUCCESS,
    FAILURE,
    TIMEOUT
}
