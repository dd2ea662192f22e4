package kr.jemi.boxoffice.seat.infrastructure.out.redis;

import kr.jemi.boxoffice.common.exception.SeatInvariantViolationException;
import kr.jemi.boxoffice.seat.application.port.out.SeatPort;
import kr.jemi.boxoffice.seat.domain.ReserveResult;
import kr.jemi.boxoffice.seat.domain.SeatState;
import kr.jemi.boxoffice.seat.domain.SeatStates;
import kr.jemi.boxoffice.seat.domain.TransitionResult;
import kr.jemi.boxoffice.seat.infrastructure.out.redis.dto.RedisSeat;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 좌석 키는 seat:{showId}:seatId, 예매 카운터는 show:{showId}:booked 이다.
 * 해시 태그로 한 상영의 키를 같은 슬롯에 모아 스크립트 하나로 전이시킨다.
 */
@Component
@ConditionalOnProperty(name = "boxoffice.seat.store", havingValue = "redis", matchIfMissing = true)
public class SeatRedisAdapter implements SeatPort {

    private static final long OK = 0;
    private static final long NOT_FOUND = 1;
    private static final long EXPIRED = 2;
    private static final long PARTIAL = 3;

    private final StringRedisTemplate redisTemplate;
    private final DefaultRedisScript<List<String>> reserveSeatsScript;
    private final DefaultRedisScript<Long> releaseSeatsScript;
    private final DefaultRedisScript<Long> renewSeatsScript;
    private final DefaultRedisScript<Long> finalizeSeatsScript;
    private final DefaultRedisScript<Long> freeSeatsScript;

    public SeatRedisAdapter(StringRedisTemplate redisTemplate,
                            @Qualifier("reserveSeatsScript") DefaultRedisScript<List<String>> reserveSeatsScript,
                            @Qualifier("releaseSeatsScript") DefaultRedisScript<Long> releaseSeatsScript,
                            @Qualifier("renewSeatsScript") DefaultRedisScript<Long> renewSeatsScript,
                            @Qualifier("finalizeSeatsScript") DefaultRedisScript<Long> finalizeSeatsScript,
                            @Qualifier("freeSeatsScript") DefaultRedisScript<Long> freeSeatsScript) {
        this.redisTemplate = redisTemplate;
        this.reserveSeatsScript = reserveSeatsScript;
        this.releaseSeatsScript = releaseSeatsScript;
        this.renewSeatsScript = renewSeatsScript;
        this.finalizeSeatsScript = finalizeSeatsScript;
        this.freeSeatsScript = freeSeatsScript;
    }

    @Override
    public ReserveResult reserveSeats(long showId, List<String> seatIds, String holdToken, Instant expiresAt) {
        List<String> takenKeys = redisTemplate.execute(reserveSeatsScript,
                seatKeys(showId, seatIds), RedisSeat.heldValue(holdToken, expiresAt));
        if (takenKeys == null || takenKeys.isEmpty()) {
            return ReserveResult.reserved();
        }
        String keyPrefix = seatKeyPrefix(showId);
        return ReserveResult.conflict(takenKeys.stream()
                .map(key -> key.substring(keyPrefix.length()))
                .toList());
    }

    @Override
    public TransitionResult releaseSeats(long showId, List<String> seatIds, String holdToken) {
        Long code = redisTemplate.execute(releaseSeatsScript,
                seatKeys(showId, seatIds), RedisSeat.heldPrefix(holdToken));
        return toResult(code, "release", showId, seatIds, holdToken);
    }

    @Override
    public TransitionResult renewSeats(long showId, List<String> seatIds, String holdToken,
                                       Instant newExpiresAt, Instant now) {
        Long code = redisTemplate.execute(renewSeatsScript,
                seatKeys(showId, seatIds),
                RedisSeat.heldPrefix(holdToken),
                String.valueOf(now.toEpochMilli()),
                RedisSeat.heldValue(holdToken, newExpiresAt));
        return toResult(code, "renew", showId, seatIds, holdToken);
    }

    @Override
    public TransitionResult finalizeSeats(long showId, List<String> seatIds, String holdToken,
                                          String bookingCode, Instant now) {
        Long code = redisTemplate.execute(finalizeSeatsScript,
                seatKeysWithCounter(showId, seatIds),
                RedisSeat.heldPrefix(holdToken),
                String.valueOf(now.toEpochMilli()),
                RedisSeat.bookedValue(bookingCode));
        return toResult(code, "finalize", showId, seatIds, holdToken);
    }

    @Override
    public TransitionResult freeSeats(long showId, List<String> seatIds, String bookingCode) {
        Long code = redisTemplate.execute(freeSeatsScript,
                seatKeysWithCounter(showId, seatIds), RedisSeat.bookedValue(bookingCode));
        return toResult(code, "free", showId, seatIds, bookingCode);
    }

    @Override
    public SeatStates getStates(long showId, List<String> seatIds) {
        List<String> values = redisTemplate.opsForValue().multiGet(seatKeys(showId, seatIds));
        Map<String, SeatState> states = new HashMap<>();
        for (int i = 0; i < seatIds.size(); i++) {
            String value = values == null ? null : values.get(i);
            states.put(seatIds.get(i), RedisSeat.from(value).toDomain());
        }
        return new SeatStates(states);
    }

    @Override
    public long countBooked(long showId) {
        String value = redisTemplate.opsForValue().get(counterKey(showId));
        return value == null ? 0 : Long.parseLong(value);
    }

    private TransitionResult toResult(Long code, String operation, long showId,
                                      List<String> seatIds, String owner) {
        if (code == null) {
            throw new IllegalStateException("좌석 스크립트 결과가 없습니다: " + operation);
        }
        if (code == OK) {
            return TransitionResult.APPLIED;
        }
        if (code == NOT_FOUND) {
            return TransitionResult.NOT_FOUND;
        }
        if (code == EXPIRED) {
            return TransitionResult.EXPIRED;
        }
        if (code == PARTIAL) {
            throw new SeatInvariantViolationException(
                    operation + " 대상 좌석 일부만 소유 중: show=" + showId + ", seats=" + seatIds + ", owner=" + owner);
        }
        throw new IllegalStateException("알 수 없는 좌석 스크립트 결과: " + code);
    }

    private List<String> seatKeys(long showId, List<String> seatIds) {
        String keyPrefix = seatKeyPrefix(showId);
        return seatIds.stream()
                .map(seatId -> keyPrefix + seatId)
                .toList();
    }

    private List<String> seatKeysWithCounter(long showId, List<String> seatIds) {
        List<String> keys = new ArrayList<>(seatKeys(showId, seatIds));
        keys.add(counterKey(showId));
        return keys;
    }

    private String seatKeyPrefix(long showId) {
        return "seat:{" + showId + "}:";
    }

    private String counterKey(long showId) {
        return "show:{" + showId + "}:booked";
    }
}
