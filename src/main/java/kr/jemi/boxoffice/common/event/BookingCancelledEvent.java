package kr.jemi.boxoffice.common.event;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

/**
 * 확정된 예매가 취소되어 좌석이 다시 판매 가능해졌다.
 * refundAmount는 취소 시점의 환불 정책으로 계산된 금액이며 실제 환불 정산은 별도로 진행된다.
 */
public record BookingCancelledEvent(long showId, List<String> seatIds, Long bookingId,
                                    String bookingCode, BigDecimal refundAmount,
                                    Instant occurredAt) implements SeatEvent {

    public BookingCancelledEvent {
        seatIds = List.copyOf(seatIds);
    }

    @Override
    public String eventType() {
        return "BookingCancelled";
    }
}
