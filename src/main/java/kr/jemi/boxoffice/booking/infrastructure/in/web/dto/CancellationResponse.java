package kr.jemi.boxoffice.booking.infrastructure.in.web.dto;

import kr.jemi.boxoffice.booking.domain.CancellationResult;

import java.math.BigDecimal;

public record CancellationResponse(long bookingId, String code, String status, BigDecimal refundAmount) {

    public static CancellationResponse from(CancellationResult result) {
        return new CancellationResponse(result.booking().getId(), result.booking().getCode(),
                result.booking().getStatus().name(), result.refundAmount());
    }
}
