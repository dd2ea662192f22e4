package kr.jemi.boxoffice.booking.domain;

import java.math.BigDecimal;

public record CancellationResult(CancellationOutcome outcome, Booking booking, BigDecimal refundAmount) {

    public static CancellationResult cancelled(Booking booking) {
        return new CancellationResult(CancellationOutcome.CANCELLED, booking, booking.getRefundAmount());
    }

    public static CancellationResult tooLate(Booking booking) {
        return new CancellationResult(CancellationOutcome.TOO_LATE_TO_CANCEL, booking, BigDecimal.ZERO);
    }

    public static CancellationResult notCancellable(Booking booking) {
        return new CancellationResult(CancellationOutcome.NOT_CANCELLABLE, booking, BigDecimal.ZERO);
    }
}
