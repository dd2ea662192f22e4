package kr.jemi.boxoffice.common.event;

public enum ReleaseReason {
    RELEASED_BY_ACTOR,
    EXPIRED,
    PAYMENT_FAILED
}
