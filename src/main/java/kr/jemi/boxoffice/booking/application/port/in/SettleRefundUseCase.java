package kr.jemi.boxoffice.booking.application.port.in;

public interface SettleRefundUseCase {

    void settle(long bookingId);
}
