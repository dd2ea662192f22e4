package kr.jemi.boxoffice.hold.infrastructure.out.redis;

import kr.jemi.boxoffice.hold.application.port.out.HoldPort;
import kr.jemi.boxoffice.hold.domain.Hold;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.RedisOperations;
import org.springframework.data.redis.core.SessionCallback;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * 선점 기록은 hold:{token} 해시에, 만료 시각은 hold:expiry 정렬 집합에 둔다.
 * 두 키는 MULTI/EXEC로 함께 쓰고 지운다.
 */
@Component
public class HoldRedisAdapter implements HoldPort {

    private static final String KEY_PREFIX = "hold:";
    private static final String EXPIRY_KEY = "hold:expiry";

    private final StringRedisTemplate redisTemplate;

    public HoldRedisAdapter(StringRedisTemplate redisTemplate) {
        this.redisTemplate = redisTemplate;
    }

    @Override
    public void save(Hold hold) {
        Map<String, String> fields = Map.of(
                "showId", String.valueOf(hold.showId()),
                "seatIds", String.join(",", hold.seatIds()),
                "actor", hold.actor(),
                "createdAt", String.valueOf(hold.createdAt().toEpochMilli()),
                "expiresAt", String.valueOf(hold.expiresAt().toEpochMilli()));
        redisTemplate.execute(new SessionCallback<>() {
            @Override
            public Object execute(RedisOperations operations) throws DataAccessException {
                operations.multi();
                operations.opsForHash().putAll(KEY_PREFIX + hold.token(), fields);
                operations.opsForZSet().add(EXPIRY_KEY, hold.token(), hold.expiresAt().toEpochMilli());
                return operations.exec();
            }
        });
    }

    @Override
    public Optional<Hold> findByToken(String token) {
        Map<Object, Object> fields = redisTemplate.opsForHash().entries(KEY_PREFIX + token);
        if (fields == null || fields.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(toHold(token, fields));
    }

    @Override
    public void delete(String token) {
        redisTemplate.execute(new SessionCallback<>() {
            @Override
            public Object execute(RedisOperations operations) throws DataAccessException {
                operations.multi();
                operations.delete(KEY_PREFIX + token);
                operations.opsForZSet().remove(EXPIRY_KEY, token);
                return operations.exec();
            }
        });
    }

    @Override
    public List<Hold> findExpired(Instant now, int limit) {
        Set<String> tokens = redisTemplate.opsForZSet()
                .rangeByScore(EXPIRY_KEY, Double.NEGATIVE_INFINITY, now.toEpochMilli(), 0, limit);
        if (tokens == null || tokens.isEmpty()) {
            return List.of();
        }
        List<Hold> expired = new ArrayList<>();
        for (String token : tokens) {
            Optional<Hold> hold = findByToken(token);
            if (hold.isPresent()) {
                expired.add(hold.get());
            } else {
                // 해시 없이 남은 만료 항목
                redisTemplate.opsForZSet().remove(EXPIRY_KEY, token);
            }
        }
        return expired;
    }

    private Hold toHold(String token, Map<Object, Object> fields) {
        return new Hold(
                token,
                Long.parseLong((String) fields.get("showId")),
                Arrays.asList(((String) fields.get("seatIds")).split(",")),
                (String) fields.get("actor"),
                Instant.ofEpochMilli(Long.parseLong((String) fields.get("createdAt"))),
                Instant.ofEpochMilli(Long.parseLong((String) fields.get("expiresAt"))));
    }
}
