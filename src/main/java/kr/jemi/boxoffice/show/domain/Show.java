package kr.jemi.boxoffice.show.domain;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import kr.jemi.boxoffice.common.validation.SelfValidating;

import java.math.BigDecimal;
import java.time.Instant;

public record Show(
        long id,
        @NotBlank String title,
        long screenId,
        @NotNull Instant scheduledAt,
        @NotNull @PositiveOrZero BigDecimal basePrice,
        @Min(1) int totalSeats
) implements SelfValidating {

    public Show(long id, String title, long screenId, Instant scheduledAt, BigDecimal basePrice, int totalSeats) {
        this.id = id;
        this.title = title;
        this.screenId = screenId;
        this.scheduledAt = scheduledAt;
        this.basePrice = basePrice;
        this.totalSeats = totalSeats;
        validateSelf();
    }
}
