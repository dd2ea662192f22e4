package kr.jemi.boxoffice.show.api;

import java.math.BigDecimal;
import java.time.Instant;

public record ShowInfo(long showId, long screenId, Instant scheduledAt, BigDecimal basePrice, int totalSeats) {
}
