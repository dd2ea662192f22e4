package kr.jemi.boxoffice.booking.domain;

/**
 * 결제/환불 요청 결과. 타임아웃은 실패와 동일하게 취급하되 사유를 구분한다.
 */
public record PaymentResult(PaymentOutcome outcome, String transactionId, String failureReason) {

    public static final String TIMEOUT_REASON = "PAYMENT_TIMEOUT";

    public PaymentResult {
        if (outcome == null) {
            throw new IllegalArgumentException("결제 결과가 없습니다");
        }
        if (outcome == PaymentOutcome.SUCCESS && (transactionId == null || transactionId.isBlank())) {
            throw new IllegalArgumentException("성공한 결제는 거래 ID가 반드시 있어야 합니다");
        }
    }

    public static PaymentResult success(String transactionId) {
        return new PaymentResult(PaymentOutcome.SUCCESS, transactionId, null);
    }

    public static PaymentResult failure(String reason) {
        return new PaymentResult(PaymentOutcome.FAILURE, null, reason);
    }

    public static PaymentResult timeout() {
        return new PaymentResult(PaymentOutcome.TIMEOUT, null, TIMEOUT_REASON);
    }
}
