package kr.jemi.boxoffice.hold.domain;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import kr.jemi.boxoffice.common.validation.SelfValidating;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * 한 사용자가 한 상영의 좌석 묶음을 일정 시간 독점하는 선점.
 * 만료 판정은 서버 시각 기준이며 expiresAt과 같은 순간부터 만료로 본다.
 */
public record Hold(
        @NotBlank String token,
        long showId,
        @NotEmpty List<String> seatIds,
        @NotBlank String actor,
        @NotNull Instant createdAt,
        @NotNull Instant expiresAt
) implements SelfValidating {

    public Hold(String token, long showId, List<String> seatIds, String actor, Instant createdAt, Instant expiresAt) {
        this.token = token;
        this.showId = showId;
        this.seatIds = seatIds == null ? null : seatIds.stream().sorted().toList();
        this.actor = actor;
        this.createdAt = createdAt;
        this.expiresAt = expiresAt;
        validateSelf();
        if (!expiresAt.isAfter(createdAt)) {
            throw new IllegalArgumentException("만료 시각은 생성 시각 이후여야 합니다");
        }
    }

    public static Hold create(String token, long showId, List<String> seatIds, String actor,
                              Instant now, Duration ttl) {
        return new Hold(token, showId, seatIds, actor, now, now.plus(ttl));
    }

    public boolean isExpiredAt(Instant now) {
        return !expiresAt.isAfter(now);
    }

    public boolean isOwnedBy(String actor) {
        return this.actor.equals(actor);
    }

    public Hold extendTo(Instant newExpiresAt) {
        if (!newExpiresAt.isAfter(expiresAt)) {
            throw new IllegalArgumentException("연장 시각은 기존 만료 시각 이후여야 합니다");
        }
        return new Hold(token, showId, seatIds, actor, createdAt, newExpiresAt);
    }
}
