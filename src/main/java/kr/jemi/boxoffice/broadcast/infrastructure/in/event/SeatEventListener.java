package kr.jemi.boxoffice.broadcast.infrastructure.in.event;

import kr.jemi.boxoffice.broadcast.application.port.in.BroadcastSeatChangeUseCase;
import kr.jemi.boxoffice.broadcast.domain.SeatChange;
import kr.jemi.boxoffice.common.event.SeatEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionalEventListener;

/**
 * 트랜잭션 밖에서 발행된 선점 이벤트도 받도록 fallbackExecution을 켠다.
 * 브로드캐스트 실패는 기록만 하고 삼킨다. 클라이언트는 재연결 시 좌석 배치도로 복구한다.
 */
@Component
public class SeatEventListener {

    private static final Logger log = LoggerFactory.getLogger(SeatEventListener.class);

    private final BroadcastSeatChangeUseCase broadcastSeatChangeUseCase;

    public SeatEventListener(BroadcastSeatChangeUseCase broadcastSeatChangeUseCase) {
        this.broadcastSeatChangeUseCase = broadcastSeatChangeUseCase;
    }

    @Async
    @TransactionalEventListener(fallbackExecution = true)
    public void handle(SeatEvent event) {
        try {
            broadcastSeatChangeUseCase.broadcast(SeatChange.from(event));
        } catch (Exception e) {
            log.warn("좌석 이벤트 브로드캐스트 실패: show={}, event={}", event.showId(), event.eventType(), e);
        }
    }
}
