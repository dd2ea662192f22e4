package kr.jemi.boxoffice.hold.application.service;

import kr.jemi.boxoffice.common.event.ReleaseReason;
import kr.jemi.boxoffice.common.event.SeatsHeldEvent;
import kr.jemi.boxoffice.common.exception.BusinessException;
import kr.jemi.boxoffice.common.exception.ErrorCode;
import kr.jemi.boxoffice.hold.api.HoldFacade;
import kr.jemi.boxoffice.hold.api.HoldView;
import kr.jemi.boxoffice.hold.application.port.in.CreateHoldUseCase;
import kr.jemi.boxoffice.hold.application.port.in.ExtendHoldUseCase;
import kr.jemi.boxoffice.hold.application.port.in.ReleaseHoldUseCase;
import kr.jemi.boxoffice.hold.application.port.out.HoldPort;
import kr.jemi.boxoffice.hold.application.port.out.SeatInventoryPort;
import kr.jemi.boxoffice.hold.application.port.out.ShowSeatPort;
import kr.jemi.boxoffice.hold.domain.Hold;
import kr.jemi.boxoffice.hold.domain.HoldResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

@Service
public class HoldService implements CreateHoldUseCase, ReleaseHoldUseCase, ExtendHoldUseCase, HoldFacade {

    private static final Logger log = LoggerFactory.getLogger(HoldService.class);

    private final HoldPort holdPort;
    private final SeatInventoryPort seatInventoryPort;
    private final ShowSeatPort showSeatPort;
    private final HoldReleaser holdReleaser;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;
    private final Duration ttl;
    private final int maxSeats;
    private final boolean extensionEnabled;

    public HoldService(HoldPort holdPort,
                       SeatInventoryPort seatInventoryPort,
                       ShowSeatPort showSeatPort,
                       HoldReleaser holdReleaser,
                       ApplicationEventPublisher eventPublisher,
                       Clock clock,
                       @Value("${boxoffice.hold.ttl}") Duration ttl,
                       @Value("${boxoffice.hold.max-seats}") int maxSeats,
                       @Value("${boxoffice.hold.extension-enabled}") boolean extensionEnabled) {
        this.holdPort = holdPort;
        this.seatInventoryPort = seatInventoryPort;
        this.showSeatPort = showSeatPort;
        this.holdReleaser = holdReleaser;
        this.eventPublisher = eventPublisher;
        this.clock = clock;
        this.ttl = ttl;
        this.maxSeats = maxSeats;
        this.extensionEnabled = extensionEnabled;
    }

    @Override
    public HoldResult createHold(long showId, List<String> seatIds, String actor) {
        // 1. 좌석 목록 검증
        validateSeats(showId, seatIds);

        // 2. 선점 기록을 먼저 남겨 좌석 선점 도중 실패해도 스윕이 회수할 수 있게 한다
        Hold hold = Hold.create(UUID.randomUUID().toString(), showId, seatIds, actor, clock.instant(), ttl);
        holdPort.save(hold);

        // 3. 좌석 묶음 원자적 선점
        List<String> conflicted;
        try {
            conflicted = seatInventoryPort.reserve(showId, hold.seatIds(), hold.token(), hold.expiresAt());
        } catch (RuntimeException e) {
            log.warn("좌석 선점 실패, 선점 기록은 스윕이 회수: token={}", hold.token(), e);
            throw e;
        }
        if (!conflicted.isEmpty()) {
            holdPort.delete(hold.token());
            return HoldResult.conflict(conflicted);
        }

        eventPublisher.publishEvent(new SeatsHeldEvent(showId, hold.seatIds(), hold.token(), hold.createdAt()));
        return HoldResult.created(hold);
    }

    @Override
    public void releaseHold(String token, String actor) {
        Hold hold = getOwnedHold(token, actor);
        holdReleaser.release(hold, ReleaseReason.RELEASED_BY_ACTOR);
    }

    @Override
    public Hold extendHold(String token, String actor) {
        if (!extensionEnabled) {
            throw new BusinessException(ErrorCode.HOLD_EXTENSION_DISABLED);
        }
        Hold hold = getOwnedHold(token, actor);
        Instant now = clock.instant();
        if (hold.isExpiredAt(now)) {
            throw new BusinessException(ErrorCode.HOLD_EXPIRED);
        }

        // 만료 인덱스를 먼저 옮긴 뒤 좌석을 연장한다. 이후 스윕은 새 만료 시각을 보므로 연장된 좌석을 회수하지 않는다.
        // 이전 시각을 이미 읽은 스윕이 끼어들면 좌석과 기록이 함께 지워지고 제출은 HOLD_EXPIRED가 된다.
        Hold extended = hold.extendTo(now.plus(ttl));
        holdPort.save(extended);
        if (!seatInventoryPort.renew(hold.showId(), hold.seatIds(), token, extended.expiresAt(), now)) {
            holdReleaser.release(extended, ReleaseReason.EXPIRED);
            throw new BusinessException(ErrorCode.HOLD_EXPIRED);
        }
        return extended;
    }

    @Override
    public Optional<HoldView> findHold(String token) {
        return holdPort.findByToken(token)
                .map(hold -> new HoldView(hold.token(), hold.showId(), hold.seatIds(), hold.actor(),
                        hold.createdAt(), hold.expiresAt()));
    }

    @Override
    public void consume(String token) {
        holdPort.delete(token);
    }

    @Override
    public void release(String token, ReleaseReason reason) {
        holdPort.findByToken(token).ifPresent(hold -> holdReleaser.release(hold, reason));
    }

    private void validateSeats(long showId, List<String> seatIds) {
        if (seatIds == null || seatIds.isEmpty()) {
            throw new BusinessException(ErrorCode.INVALID_SEATS);
        }
        if (seatIds.size() > maxSeats) {
            throw new BusinessException(ErrorCode.TOO_MANY_SEATS);
        }
        Set<String> screenSeatIds = showSeatPort.findSeatIds(showId)
                .orElseThrow(() -> new BusinessException(ErrorCode.SHOW_NOT_FOUND));
        Set<String> distinct = new HashSet<>(seatIds);
        if (distinct.size() != seatIds.size() || !screenSeatIds.containsAll(distinct)) {
            throw new BusinessException(ErrorCode.INVALID_SEATS);
        }
    }

    private Hold getOwnedHold(String token, String actor) {
        Hold hold = holdPort.findByToken(token)
                .orElseThrow(() -> new BusinessException(ErrorCode.HOLD_NOT_FOUND));
        if (!hold.isOwnedBy(actor)) {
            throw new BusinessException(ErrorCode.HOLD_ACCESS_DENIED);
        }
        return hold;
    }
}
