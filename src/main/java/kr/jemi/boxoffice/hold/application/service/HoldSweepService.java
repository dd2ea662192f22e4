package kr.jemi.boxoffice.hold.application.service;

import kr.jemi.boxoffice.common.event.ReleaseReason;
import kr.jemi.boxoffice.hold.application.port.in.SweepExpiredHoldsUseCase;
import kr.jemi.boxoffice.hold.application.port.out.HoldPort;
import kr.jemi.boxoffice.hold.domain.Hold;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;

@Service
public class HoldSweepService implements SweepExpiredHoldsUseCase {

    private static final Logger log = LoggerFactory.getLogger(HoldSweepService.class);

    private final HoldPort holdPort;
    private final HoldReleaser holdReleaser;
    private final Clock clock;
    private final int batchSize;

    public HoldSweepService(HoldPort holdPort,
                            HoldReleaser holdReleaser,
                            Clock clock,
                            @Value("${boxoffice.hold.sweep-batch-size}") int batchSize) {
        this.holdPort = holdPort;
        this.holdReleaser = holdReleaser;
        this.clock = clock;
        this.batchSize = batchSize;
    }

    /**
     * 만료된 선점을 배치 단위로 해제한다. 해제 실패가 있으면 남은 선점은 다음 주기로 넘긴다.
     */
    @Override
    public int sweepExpired() {
        int swept = 0;
        while (true) {
            List<Hold> expired = holdPort.findExpired(clock.instant(), batchSize);
            int failed = 0;
            for (Hold hold : expired) {
                try {
                    holdReleaser.release(hold, ReleaseReason.EXPIRED);
                    swept++;
                } catch (RuntimeException e) {
                    failed++;
                    log.error("만료 선점 해제 실패: token={}, show={}", hold.token(), hold.showId(), e);
                }
            }
            if (failed > 0 || expired.size() < batchSize) {
                break;
            }
        }
        if (swept > 0) {
            log.info("만료 선점 해제 완료: {}건", swept);
        }
        return swept;
    }
}
