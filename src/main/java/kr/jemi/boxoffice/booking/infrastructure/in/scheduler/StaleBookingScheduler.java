package kr.jemi.boxoffice.booking.infrastructure.in.scheduler;

import kr.jemi.boxoffice.booking.application.port.in.ExpireStaleBookingsUseCase;
import net.javacrumbs.shedlock.spring.annotation.SchedulerLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
public class StaleBookingScheduler {

    private static final Logger log = LoggerFactory.getLogger(StaleBookingScheduler.class);

    private final ExpireStaleBookingsUseCase expireStaleBookingsUseCase;

    public StaleBookingScheduler(ExpireStaleBookingsUseCase expireStaleBookingsUseCase) {
        this.expireStaleBookingsUseCase = expireStaleBookingsUseCase;
    }

    @Scheduled(cron = "${boxoffice.booking.stale-cron}")
    @SchedulerLock(name = "expireStaleBookings",
            lockAtMostFor = "${boxoffice.booking.stale-lock-at-most-for}",
            lockAtLeastFor = "${boxoffice.booking.stale-lock-at-least-for}")
    public void expireStale() {
        try {
            expireStaleBookingsUseCase.expireStale();
        } catch (Exception e) {
            log.error("방치된 대기 예매 정리 실패", e);
        }
    }
}
