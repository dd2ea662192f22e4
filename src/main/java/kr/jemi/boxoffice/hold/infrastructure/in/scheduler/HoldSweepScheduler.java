package kr.jemi.boxoffice.hold.infrastructure.in.scheduler;

import kr.jemi.boxoffice.hold.application.port.in.SweepExpiredHoldsUseCase;
import net.javacrumbs.shedlock.spring.annotation.SchedulerLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
public class HoldSweepScheduler {

    private static final Logger log = LoggerFactory.getLogger(HoldSweepScheduler.class);

    private final SweepExpiredHoldsUseCase sweepExpiredHoldsUseCase;

    public HoldSweepScheduler(SweepExpiredHoldsUseCase sweepExpiredHoldsUseCase) {
        this.sweepExpiredHoldsUseCase = sweepExpiredHoldsUseCase;
    }

    @Scheduled(fixedDelayString = "${boxoffice.hold.sweep-interval}")
    @SchedulerLock(name = "sweepExpiredHolds",
            lockAtMostFor = "${boxoffice.hold.sweep-lock-at-most-for}",
            lockAtLeastFor = "${boxoffice.hold.sweep-lock-at-least-for}")
    public void sweep() {
        try {
            sweepExpiredHoldsUseCase.sweepExpired();
        } catch (Exception e) {
            log.error("만료 선점 스윕 실패", e);
        }
    }
}
