package kr.jemi.boxoffice.booking.application.service;

import kr.jemi.boxoffice.booking.application.port.in.CancelBookingUseCase;
import kr.jemi.boxoffice.booking.application.port.out.BookingPort;
import kr.jemi.boxoffice.booking.application.port.out.ShowCatalogPort;
import kr.jemi.boxoffice.booking.domain.Booking;
import kr.jemi.boxoffice.booking.domain.BookingStatus;
import kr.jemi.boxoffice.booking.domain.CancellationResult;
import kr.jemi.boxoffice.booking.domain.RefundPolicy;
import kr.jemi.boxoffice.booking.domain.ShowSchedule;
import kr.jemi.boxoffice.common.exception.BusinessException;
import kr.jemi.boxoffice.common.exception.ErrorCode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

@Service
public class CancellationService implements CancelBookingUseCase {

    private static final Logger log = LoggerFactory.getLogger(CancellationService.class);

    private final BookingPort bookingPort;
    private final BookingWriter bookingWriter;
    private final ShowCatalogPort showCatalogPort;
    private final RefundPolicy refundPolicy;
    private final Clock clock;

    public CancellationService(BookingPort bookingPort,
                               BookingWriter bookingWriter,
                               ShowCatalogPort showCatalogPort,
                               RefundPolicy refundPolicy,
                               Clock clock) {
        this.bookingPort = bookingPort;
        this.bookingWriter = bookingWriter;
        this.showCatalogPort = showCatalogPort;
        this.refundPolicy = refundPolicy;
        this.clock = clock;
    }

    @Override
    public CancellationResult cancel(long bookingId, String actor) {
        Booking booking = bookingPort.findById(bookingId)
                .orElseThrow(() -> new BusinessException(ErrorCode.BOOKING_NOT_FOUND));
        if (!booking.isOwnedBy(actor)) {
            throw new BusinessException(ErrorCode.BOOKING_ACCESS_DENIED);
        }
        if (booking.getStatus() != BookingStatus.CONFIRMED) {
            return CancellationResult.notCancellable(booking);
        }

        ShowSchedule schedule = showCatalogPort.findSchedule(booking.getShowId())
                .orElseThrow(() -> new BusinessException(ErrorCode.SHOW_NOT_FOUND));
        Instant now = clock.instant();
        Duration timeToShow = schedule.timeToShowFrom(now);
        if (!refundPolicy.isCancellable(timeToShow)) {
            return CancellationResult.tooLate(booking);
        }

        BigDecimal refund = refundPolicy.refundFor(booking.getPrice().finalAmount(), timeToShow);
        booking.cancel(refund, now);
        try {
            // 좌석은 커밋 이후 BookingCancelledEvent 처리에서 반환한다
            booking = bookingWriter.update(booking);
        } catch (OptimisticLockingFailureException e) {
            log.info("동시 취소 감지: bookingId={}", bookingId);
            return bookingPort.findById(bookingId)
                    .map(CancellationResult::notCancellable)
                    .orElseThrow(() -> new BusinessException(ErrorCode.BOOKING_NOT_FOUND));
        }
        log.info("예매 취소: code={}, refund={}", booking.getCode(), refund);
        return CancellationResult.cancelled(booking);
    }
}
