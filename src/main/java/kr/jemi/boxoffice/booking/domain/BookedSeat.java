package kr.jemi.boxoffice.booking.domain;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import kr.jemi.boxoffice.common.validation.SelfValidating;

import java.math.BigDecimal;

/**
 * 예매 시점의 좌석별 가격. 이후 카탈로그 가격이 바뀌어도 변하지 않는다.
 */
public record BookedSeat(
        @NotBlank String seatId,
        @NotBlank String tier,
        @NotNull @PositiveOrZero BigDecimal price
) implements SelfValidating {

    public BookedSeat(String seatId, String tier, BigDecimal price) {
        this.seatId = seatId;
        this.tier = tier;
        this.price = price;
        validateSelf();
    }
}
