package kr.jemi.boxoffice.booking.domain;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import kr.jemi.boxoffice.common.validation.SelfValidating;

import java.math.BigDecimal;

public record BookingPrice(
        @NotNull @PositiveOrZero BigDecimal subtotal,
        @NotNull @PositiveOrZero BigDecimal fee,
        @NotNull @PositiveOrZero BigDecimal discount,
        @NotNull @PositiveOrZero BigDecimal finalAmount,
        String promoCode
) implements SelfValidating {

    public BookingPrice(BigDecimal subtotal, BigDecimal fee, BigDecimal discount, BigDecimal finalAmount,
                        String promoCode) {
        this.subtotal = subtotal;
        this.fee = fee;
        this.discount = discount;
        this.finalAmount = finalAmount;
        this.promoCode = promoCode;
        validateSelf();
    }

    public boolean isFree() {
        return finalAmount.signum() == 0;
    }
}
