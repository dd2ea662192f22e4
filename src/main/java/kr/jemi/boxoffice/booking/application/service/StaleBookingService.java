package kr.jemi.boxoffice.booking.application.service;

import kr.jemi.boxoffice.booking.application.config.BookingProperties;
import kr.jemi.boxoffice.booking.application.port.in.ExpireStaleBookingsUseCase;
import kr.jemi.boxoffice.booking.application.port.out.BookingPort;
import kr.jemi.boxoffice.booking.domain.Booking;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * 결제 도중 프로세스가 죽어 PENDING으로 남은 예매를 만료시킨다.
 * 선점 유효 시간 + 결제 타임아웃 + 여유 시간이 지나면 결제 흐름이 끝났다고 본다. 좌석은 이미 스윕이 회수했다.
 */
@Service
public class StaleBookingService implements ExpireStaleBookingsUseCase {

    private static final Logger log = LoggerFactory.getLogger(StaleBookingService.class);

    private static final String STALE_REASON = "STALE_PENDING";

    private final BookingPort bookingPort;
    private final BookingWriter bookingWriter;
    private final Clock clock;
    private final Duration staleAfter;
    private final int batchSize;

    public StaleBookingService(BookingPort bookingPort,
                               BookingWriter bookingWriter,
                               Clock clock,
                               BookingProperties properties,
                               @Value("${boxoffice.hold.ttl}") Duration holdTtl,
                               @Value("${boxoffice.payment.read-timeout}") Duration paymentTimeout) {
        this.bookingPort = bookingPort;
        this.bookingWriter = bookingWriter;
        this.clock = clock;
        this.staleAfter = holdTtl.plus(paymentTimeout).plus(properties.staleGrace());
        this.batchSize = properties.staleBatchSize();
    }

    @Override
    public int expireStale() {
        Instant now = clock.instant();
        List<Booking> stale = bookingPort.findPendingCreatedBefore(now.minus(staleAfter), batchSize);
        int expired = 0;
        for (Booking booking : stale) {
            booking.expire(STALE_REASON, now);
            try {
                bookingWriter.update(booking);
                expired++;
            } catch (OptimisticLockingFailureException e) {
                log.info("대기 예매가 다른 흐름에서 먼저 변경됨: code={}", booking.getCode());
            }
        }
        if (expired > 0) {
            log.warn("방치된 대기 예매 만료: {}건", expired);
        }
        return expired;
    }
}
