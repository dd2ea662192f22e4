package kr.jemi.boxoffice.booking.domain;

public enum FinalizeOutcome {
    FINALIZED,
    EXPIRED,
    NOT_FOUND
}
