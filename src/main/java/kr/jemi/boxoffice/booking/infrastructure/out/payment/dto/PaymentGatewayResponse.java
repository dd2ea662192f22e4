package kr.jemi.boxoffice.booking.infrastructure.out.payment.dto;

/**
 * 결제 대행사 응답. status는 APPROVED 또는 DECLINED.
 */
public record PaymentGatewayResponse(String transactionId, String status, String reason) {

    public boolean isApproved() {
        return "APPROVED".equals(status);
    }

    public boolean hasTransactionId() {
        return transactionId != null && !transactionId.isBlank();
    }
}
