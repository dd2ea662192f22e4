package kr.jemi.boxoffice.booking.domain;

import java.math.BigDecimal;

public record RefundRequestedEvent(long bookingId, String bookingCode, BigDecimal amount) {
}
