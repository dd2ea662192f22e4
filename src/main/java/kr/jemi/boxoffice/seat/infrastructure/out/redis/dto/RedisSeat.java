package kr.jemi.boxoffice.seat.infrastructure.out.redis.dto;

import kr.jemi.boxoffice.seat.domain.SeatState;
import kr.jemi.boxoffice.seat.domain.SeatStatus;

import java.time.Instant;

/**
 * Redis에 저장된 좌석 값("held:token:expiresAtMillis", "booked:code", null)을 파싱하는 adapter DTO.
 */
public record RedisSeat(SeatStatus status, String owner, Instant heldUntil) {

    private static final String HELD_PREFIX = "held:";
    private static final String BOOKED_PREFIX = "booked:";

    public static RedisSeat from(String redisValue) {
        if (redisValue == null) {
            return new RedisSeat(SeatStatus.AVAILABLE, null, null);
        }
        if (redisValue.startsWith(HELD_PREFIX)) {
            String body = redisValue.substring(HELD_PREFIX.length());
            int separator = body.lastIndexOf(':');
            if (separator <= 0) {
                throw new IllegalArgumentException("알 수 없는 Redis 좌석 값: " + redisValue);
            }
            try {
                long expiresAtMillis = Long.parseLong(body.substring(separator + 1));
                return new RedisSeat(SeatStatus.HELD, body.substring(0, separator),
                        Instant.ofEpochMilli(expiresAtMillis));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("알 수 없는 Redis 좌석 값: " + redisValue, e);
            }
        }
        if (redisValue.startsWith(BOOKED_PREFIX)) {
            return new RedisSeat(SeatStatus.BOOKED, redisValue.substring(BOOKED_PREFIX.length()), null);
        }
        throw new IllegalArgumentException("알 수 없는 Redis 좌석 값: " + redisValue);
    }

    public static String heldPrefix(String holdToken) {
        return HELD_PREFIX + holdToken + ":";
    }

    public static String heldValue(String holdToken, Instant expiresAt) {
        return heldPrefix(holdToken) + expiresAt.toEpochMilli();
    }

    public static String bookedValue(String bookingCode) {
        return BOOKED_PREFIX + bookingCode;
    }

    public SeatState toDomain() {
        return new SeatState(status, owner, heldUntil);
    }
}
