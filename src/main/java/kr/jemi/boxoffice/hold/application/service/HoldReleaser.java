package kr.jemi.boxoffice.hold.application.service;

import kr.jemi.boxoffice.common.event.ReleaseReason;
import kr.jemi.boxoffice.common.event.SeatsReleasedEvent;
import kr.jemi.boxoffice.hold.application.port.out.HoldPort;
import kr.jemi.boxoffice.hold.application.port.out.SeatInventoryPort;
import kr.jemi.boxoffice.hold.domain.Hold;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.time.Clock;

@Service
public class HoldReleaser {

    private final HoldPort holdPort;
    private final SeatInventoryPort seatInventoryPort;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    public HoldReleaser(HoldPort holdPort,
                        SeatInventoryPort seatInventoryPort,
                        ApplicationEventPublisher eventPublisher,
                        Clock clock) {
        this.holdPort = holdPort;
        this.seatInventoryPort = seatInventoryPort;
        this.eventPublisher = eventPublisher;
        this.clock = clock;
    }

    /**
     * 좌석을 먼저 되돌린 뒤 선점 기록을 지운다. 그 사이에 실패하면 기록이 남아 스윕이 다시 처리한다.
     * 좌석이 이미 예매로 전환되었거나 해제된 경우 기록만 지운다.
     *
     * @return 좌석을 실제로 되돌렸는지 여부
     */
    public boolean release(Hold hold, ReleaseReason reason) {
        boolean released = seatInventoryPort.release(hold.showId(), hold.seatIds(), hold.token());
        holdPort.delete(hold.token());
        if (released) {
            eventPublisher.publishEvent(new SeatsReleasedEvent(
                    hold.showId(), hold.seatIds(), hold.token(), reason, clock.instant()));
        }
        return released;
    }
}
