package kr.jemi.boxoffice.booking.domain;

import java.time.Duration;
import java.time.Instant;

public record ShowSchedule(long showId, Instant scheduledAt) {

    public Duration timeToShowFrom(Instant now) {
        return Duration.between(now, scheduledAt);
    }
}
