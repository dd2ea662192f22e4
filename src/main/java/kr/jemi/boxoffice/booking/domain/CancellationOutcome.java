package kr.jemi.boxoffice.booking.domain;

public enum CancellationOutcome {
    CANCELLED,
    TOO_LATE_TO_CANCEL,
    NOT_CANCELLABLE
}
