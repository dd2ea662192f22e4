package kr.jemi.boxoffice.seat.domain;

/**
 * 선점/예매 소유자가 좌석 묶음 전체를 전이시킨 결과.
 * 일부 좌석만 소유한 경우는 결과가 아니라 불변식 위반 예외로 다룬다.
 */
public enum TransitionResult {
    APPLIED,
    EXPIRED,
    NOT_FOUND
}
