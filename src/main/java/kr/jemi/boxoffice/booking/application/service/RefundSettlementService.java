package kr.jemi.boxoffice.booking.application.service;

import kr.jemi.boxoffice.booking.application.port.in.SettleRefundUseCase;
import kr.jemi.boxoffice.booking.application.port.out.BookingPort;
import kr.jemi.boxoffice.booking.application.port.out.PaymentPort;
import kr.jemi.boxoffice.booking.domain.Booking;
import kr.jemi.boxoffice.booking.domain.PaymentResult;
import kr.jemi.boxoffice.common.exception.BusinessException;
import kr.jemi.boxoffice.common.exception.ErrorCode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;

/**
 * 환불 요청을 결제 대행사에 전달한다. 실패하면 예외를 던져 이벤트 발행 기록이 미완료로 남고
 * 재발행 스케줄러가 다시 시도한다. 환불 멱등키는 예매 코드 기준이라 재시도해도 한 번만 환불된다.
 */
@Service
public class RefundSettlementService implements SettleRefundUseCase {

    private static final Logger log = LoggerFactory.getLogger(RefundSettlementService.class);

    private static final String REFUND_KEY_PREFIX = "refund:";

    private final BookingPort bookingPort;
    private final BookingWriter bookingWriter;
    private final PaymentPort paymentPort;
    private final Clock clock;

    public RefundSettlementService(BookingPort bookingPort,
                                   BookingWriter bookingWriter,
                                   PaymentPort paymentPort,
                                   Clock clock) {
        this.bookingPort = bookingPort;
        this.bookingWriter = bookingWriter;
        this.paymentPort = paymentPort;
        this.clock = clock;
    }

    @Override
    public void settle(long bookingId) {
        Booking booking = bookingPort.findById(bookingId)
                .orElseThrow(() -> new IllegalStateException("환불 대상 예매를 찾을 수 없습니다: id=" + bookingId));
        if (booking.isRefundSettled()) {
            return;
        }

        PaymentResult result = paymentPort.refund(booking.getPaymentTransactionId(), booking.getRefundAmount(),
                REFUND_KEY_PREFIX + booking.getCode());
        switch (result.outcome()) {
            case SUCCESS -> {
                booking.markRefunded(result.transactionId(), clock.instant());
                bookingWriter.update(booking);
                log.info("환불 완료: code={}, amount={}, refundTx={}",
                        booking.getCode(), booking.getRefundAmount(), result.transactionId());
            }
            case FAILURE, TIMEOUT -> {
                log.warn("환불 실패, 재시도 대기: code={}, reason={}", booking.getCode(), result.failureReason());
                throw new BusinessException(ErrorCode.REFUND_FAILED, booking.getCode());
            }
        }
    }
}
