package kr.jemi.boxoffice.common.exception;

/**
 * (상영, 좌석) 한 쌍이 동시에 두 개의 비가용 상태를 가지게 되는 상황.
 * 올바른 구현에서는 도달할 수 없으므로 복구하지 않고 요청 전체를 실패시킨다.
 */
public class SeatInvariantViolationException extends RuntimeException {

    public SeatInvariantViolationException(String message) {
        super(message);
    }
}
