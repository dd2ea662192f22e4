package kr.jemi.boxoffice.booking.domain;

/**
 * 예매 제출 결과. 선점이 처음부터 없던 경우 booking은 null이다.
 */
public record BookingResult(BookingOutcome outcome, Booking booking, String failureReason) {

    public static BookingResult confirmed(Booking booking) {
        return new BookingResult(BookingOutcome.CONFIRMED, booking, null);
    }

    public static BookingResult holdExpired(Booking booking) {
        return new BookingResult(BookingOutcome.HOLD_EXPIRED, booking, "HOLD_EXPIRED");
    }

    public static BookingResult paymentFailed(Booking booking, String reason) {
        return new BookingResult(BookingOutcome.PAYMENT_FAILED, booking, reason);
    }

    public static BookingResult inProgress(Booking booking) {
        return new BookingResult(BookingOutcome.IN_PROGRESS, booking, null);
    }
}
