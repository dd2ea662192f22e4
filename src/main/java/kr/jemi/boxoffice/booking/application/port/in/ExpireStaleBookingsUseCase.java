package kr.jemi.boxoffice.booking.application.port.in;

public interface ExpireStaleBookingsUseCase {

    int expireStale();
}
