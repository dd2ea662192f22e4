package kr.jemi.boxoffice.booking.application.port.out;

import kr.jemi.boxoffice.booking.domain.PaymentResult;

import java.math.BigDecimal;

public interface PaymentPort {

    PaymentResult charge(BigDecimal amount, String paymentMethod, String idempotencyKey);

    PaymentResult refund(String paymentTransactionId, BigDecimal amount, String idempotencyKey);
}
