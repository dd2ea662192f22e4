package kr.jemi.boxoffice.booking.infrastructure.in.web.dto;

import jakarta.validation.constraints.NotBlank;

public record SubmitBookingRequest(
        @NotBlank String holdToken,
        @NotBlank String paymentMethod,
        String promoCode
) {
}
