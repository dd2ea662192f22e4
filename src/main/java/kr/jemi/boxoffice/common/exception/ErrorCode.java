package kr.jemi.boxoffice.common.exception;

import org.springframework.http.HttpStatus;

public enum ErrorCode {

    INVALID_REQUEST(400, "요청 형식이 올바르지 않습니다"),
    SHOW_NOT_FOUND(404, "상영 정보를 찾을 수 없습니다"),
    INVALID_SEATS(400, "존재하지 않거나 중복된 좌석이 포함되어 있습니다"),
    TOO_MANY_SEATS(400, "한 번에 선점할 수 있는 좌석 수를 초과했습니다"),
    SEAT_CONFLICT(409, "이미 선점되었거나 예매된 좌석이 포함되어 있습니다"),
    HOLD_NOT_FOUND(404, "선점 정보를 찾을 수 없습니다"),
    HOLD_ACCESS_DENIED(403, "본인의 선점만 처리할 수 있습니다"),
    HOLD_EXPIRED(410, "선점 시간이 만료되었습니다. 좌석을 다시 선택해 주세요"),
    HOLD_EXTENSION_DISABLED(400, "선점 연장이 허용되지 않습니다"),
    INVALID_PROMO_CODE(400, "유효하지 않은 프로모션 코드입니다"),
    BOOKING_NOT_FOUND(404, "예매를 찾을 수 없습니다"),
    BOOKING_ACCESS_DENIED(403, "본인의 예매만 처리할 수 있습니다"),
    BOOKING_IN_PROGRESS(409, "해당 선점으로 진행 중인 예매가 있습니다"),
    PAYMENT_FAILED(402, "결제에 실패했습니다. 좌석 선점이 해제되었습니다"),
    BOOKING_NOT_CANCELLABLE(409, "취소할 수 없는 예매 상태입니다"),
    TOO_LATE_TO_CANCEL(422, "상영 시작이 임박하여 취소할 수 없습니다"),
    BOOKING_CONFIRM_FAILED(500, "예매 확정에 실패했습니다"),
    REFUND_FAILED(502, "환불 처리에 실패했습니다"),
    INVARIANT_VIOLATION(500, "좌석 상태 불변식이 깨졌습니다"),
    INTERNAL_ERROR(500, "내부 서버 오류가 발생했습니다");

    private final HttpStatus status;
    private final String message;

    ErrorCode(int statusCode, String message) {
        this.status = HttpStatus.valueOf(statusCode);
        this.message = message;
    }

    public HttpStatus getStatus() {
        return status;
    }

    public String getMessage() {
        return message;
    }
}
