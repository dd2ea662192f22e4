package kr.jemi.boxoffice.seat.infrastructure.out.memory;

import kr.jemi.boxoffice.common.exception.SeatInvariantViolationException;
import kr.jemi.boxoffice.seat.application.port.out.SeatPort;
import kr.jemi.boxoffice.seat.domain.ReserveResult;
import kr.jemi.boxoffice.seat.domain.SeatState;
import kr.jemi.boxoffice.seat.domain.SeatStates;
import kr.jemi.boxoffice.seat.domain.TransitionResult;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * 단일 노드용 좌석 저장소. 좌석 키를 고정 개수의 락 스트라이프에 나눠 담고, 스트라이프 번호 순으로 잡아
 * 교착 없이 묶음 전이를 원자적으로 수행한다. 상영이 늘어도 락 개수는 늘지 않는다.
 */
@Component
@ConditionalOnProperty(name = "boxoffice.seat.store", havingValue = "memory")
public class SeatInMemoryAdapter implements SeatPort {

    private static final int DEFAULT_LOCK_STRIPES = 256;

    private final Map<String, SeatState> seats = new ConcurrentHashMap<>();
    private final ReentrantLock[] lockStripes;
    private final Map<Long, AtomicLong> bookedCounts = new ConcurrentHashMap<>();

    public SeatInMemoryAdapter() {
        this(DEFAULT_LOCK_STRIPES);
    }

    SeatInMemoryAdapter(int stripes) {
        if (stripes < 1) {
            throw new IllegalArgumentException("락 스트라이프는 1개 이상이어야 합니다: " + stripes);
        }
        this.lockStripes = new ReentrantLock[stripes];
        for (int i = 0; i < stripes; i++) {
            lockStripes[i] = new ReentrantLock();
        }
    }

    @Override
    public ReserveResult reserveSeats(long showId, List<String> seatIds, String holdToken, Instant expiresAt) {
        return withLocks(showId, seatIds, () -> {
            List<String> taken = seatIds.stream()
                    .filter(seatId -> seats.containsKey(key(showId, seatId)))
                    .toList();
            if (!taken.isEmpty()) {
                return ReserveResult.conflict(taken);
            }
            SeatState held = SeatState.held(holdToken, expiresAt);
            seatIds.forEach(seatId -> seats.put(key(showId, seatId), held));
            return ReserveResult.reserved();
        });
    }

    @Override
    public TransitionResult releaseSeats(long showId, List<String> seatIds, String holdToken) {
        return withLocks(showId, seatIds, () -> {
            int owned = countOwned(showId, seatIds, state -> state.isHeldBy(holdToken));
            TransitionResult precheck = precheck(owned, seatIds, "release", showId, holdToken);
            if (precheck != null) {
                return precheck;
            }
            seatIds.forEach(seatId -> seats.remove(key(showId, seatId)));
            return TransitionResult.APPLIED;
        });
    }

    @Override
    public TransitionResult renewSeats(long showId, List<String> seatIds, String holdToken,
                                       Instant newExpiresAt, Instant now) {
        return withLocks(showId, seatIds, () -> {
            int owned = countOwned(showId, seatIds, state -> state.isHeldBy(holdToken));
            TransitionResult precheck = precheck(owned, seatIds, "renew", showId, holdToken);
            if (precheck != null) {
                return precheck;
            }
            if (anyExpired(showId, seatIds, now)) {
                return TransitionResult.EXPIRED;
            }
            SeatState renewed = SeatState.held(holdToken, newExpiresAt);
            seatIds.forEach(seatId -> seats.put(key(showId, seatId), renewed));
            return TransitionResult.APPLIED;
        });
    }

    @Override
    public TransitionResult finalizeSeats(long showId, List<String> seatIds, String holdToken,
                                          String bookingCode, Instant now) {
        return withLocks(showId, seatIds, () -> {
            int owned = countOwned(showId, seatIds, state -> state.isHeldBy(holdToken));
            TransitionResult precheck = precheck(owned, seatIds, "finalize", showId, holdToken);
            if (precheck != null) {
                return precheck;
            }
            if (anyExpired(showId, seatIds, now)) {
                return TransitionResult.EXPIRED;
            }
            SeatState booked = SeatState.booked(bookingCode);
            seatIds.forEach(seatId -> seats.put(key(showId, seatId), booked));
            counter(showId).addAndGet(seatIds.size());
            return TransitionResult.APPLIED;
        });
    }

    @Override
    public TransitionResult freeSeats(long showId, List<String> seatIds, String bookingCode) {
        return withLocks(showId, seatIds, () -> {
            int owned = countOwned(showId, seatIds, state -> state.isBookedBy(bookingCode));
            TransitionResult precheck = precheck(owned, seatIds, "free", showId, bookingCode);
            if (precheck != null) {
                return precheck;
            }
            AtomicLong counter = counter(showId);
            if (counter.get() < seatIds.size()) {
                throw new SeatInvariantViolationException(
                        "예매 좌석 카운터가 음수가 됩니다: show=" + showId + ", booked=" + counter.get());
            }
            seatIds.forEach(seatId -> seats.remove(key(showId, seatId)));
            counter.addAndGet(-seatIds.size());
            return TransitionResult.APPLIED;
        });
    }

    @Override
    public SeatStates getStates(long showId, List<String> seatIds) {
        Map<String, SeatState> states = new HashMap<>();
        for (String seatId : seatIds) {
            states.put(seatId, seats.getOrDefault(key(showId, seatId), SeatState.available()));
        }
        return new SeatStates(states);
    }

    @Override
    public long countBooked(long showId) {
        return counter(showId).get();
    }

    private <T> T withLocks(long showId, List<String> seatIds, Supplier<T> action) {
        List<ReentrantLock> acquired = new ArrayList<>();
        // 같은 스트라이프는 한 번만 잡는다
        int[] orderedStripes = seatIds.stream()
                .mapToInt(seatId -> stripeOf(key(showId, seatId)))
                .distinct()
                .sorted()
                .toArray();
        try {
            for (int stripe : orderedStripes) {
                ReentrantLock lock = lockStripes[stripe];
                lock.lock();
                acquired.add(lock);
            }
            return action.get();
        } finally {
            for (int i = acquired.size() - 1; i >= 0; i--) {
                acquired.get(i).unlock();
            }
        }
    }

    int lockStripeCount() {
        return lockStripes.length;
    }

    private int stripeOf(String key) {
        return Math.floorMod(key.hashCode(), lockStripes.length);
    }

    private int countOwned(long showId, List<String> seatIds, Predicate<SeatState> owns) {
        int owned = 0;
        for (String seatId : seatIds) {
            SeatState state = seats.get(key(showId, seatId));
            if (state != null && owns.test(state)) {
                owned++;
            }
        }
        return owned;
    }

    private TransitionResult precheck(int owned, List<String> seatIds, String operation,
                                      long showId, String owner) {
        if (owned == 0) {
            return TransitionResult.NOT_FOUND;
        }
        if (owned < seatIds.size()) {
            throw new SeatInvariantViolationException(
                    operation + " 대상 좌석 일부만 소유 중: show=" + showId + ", seats=" + seatIds + ", owner=" + owner);
        }
        return null;
    }

    private boolean anyExpired(long showId, List<String> seatIds, Instant now) {
        return seatIds.stream()
                .map(seatId -> seats.get(key(showId, seatId)))
                .anyMatch(state -> state.isExpiredAt(now));
    }

    private AtomicLong counter(long showId) {
        return bookedCounts.computeIfAbsent(showId, id -> new AtomicLong());
    }

    private String key(long showId, String seatId) {
        return showId + ":" + seatId;
    }
}
