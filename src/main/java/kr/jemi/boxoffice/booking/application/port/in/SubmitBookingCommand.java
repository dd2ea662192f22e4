package kr.jemi.boxoffice.booking.application.port.in;

import jakarta.validation.constraints.NotBlank;
import kr.jemi.boxoffice.common.validation.SelfValidating;

public record SubmitBookingCommand(
        @NotBlank String holdToken,
        @NotBlank String actor,
        @NotBlank String paymentMethod,
        String promoCode
) implements SelfValidating {

    public SubmitBookingCommand(String holdToken, String actor, String paymentMethod, String promoCode) {
        this.holdToken = holdToken;
        this.actor = actor;
        this.paymentMethod = paymentMethod;
        this.promoCode = promoCode;
        validateSelf();
    }
}
