package kr.jemi.boxoffice.common.infrastructure.in.scheduler;

import net.javacrumbs.shedlock.spring.annotation.SchedulerLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.modulith.events.IncompleteEventPublications;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * 리스너 실패로 완료되지 않은 이벤트(환불 정산 등)를 주기적으로 재발행한다.
 */
@Component
public class EventResubmitScheduler {

    private static final Logger log = LoggerFactory.getLogger(EventResubmitScheduler.class);

    private final IncompleteEventPublications incompleteEventPublications;
    private final Duration olderThan;

    public EventResubmitScheduler(IncompleteEventPublications incompleteEventPublications,
                                  @Value("${boxoffice.event-resubmit.older-than}") Duration olderThan) {
        this.incompleteEventPublications = incompleteEventPublications;
        this.olderThan = olderThan;
    }

    @Scheduled(cron = "${boxoffice.event-resubmit.cron}")
    @SchedulerLock(name = "resubmitIncompleteEvents",
            lockAtMostFor = "${boxoffice.event-resubmit.lock-at-most-for}",
            lockAtLeastFor = "${boxoffice.event-resubmit.lock-at-least-for}")
    public void resubmitIncompleteEvents() {
        try {
            incompleteEventPublications.resubmitIncompletePublicationsOlderThan(olderThan);
        } catch (Exception e) {
            log.error("미완료 이벤트 재발행 스케줄러 실패", e);
        }
    }
}
