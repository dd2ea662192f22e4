package kr.jemi.boxoffice.booking.infrastructure.out.payment.dto;

import java.math.BigDecimal;

public record RefundRequest(String transactionId, BigDecimal amount) {
}
