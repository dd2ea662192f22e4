package kr.jemi.boxoffice.show.domain;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import kr.jemi.boxoffice.common.validation.SelfValidating;

import java.math.BigDecimal;

/**
 * 상영관의 물리 좌석. 등급별 가격 차이(priceDelta)는 음수일 수 있다.
 */
public record ScreenSeat(
        @NotBlank String seatId,
        long screenId,
        @NotBlank String tier,
        @NotNull BigDecimal priceDelta
) implements SelfValidating {

    public ScreenSeat(String seatId, long screenId, String tier, BigDecimal priceDelta) {
        this.seatId = seatId;
        this.screenId = screenId;
        this.tier = tier;
        this.priceDelta = priceDelta;
        validateSelf();
    }

    public BigDecimal priceOn(Show show) {
        return show.basePrice().add(priceDelta).max(BigDecimal.ZERO);
    }
}
