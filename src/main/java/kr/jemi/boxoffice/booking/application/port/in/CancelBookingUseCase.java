package kr.jemi.boxoffice.booking.application.port.in;

import kr.jemi.boxoffice.booking.domain.CancellationResult;

public interface CancelBookingUseCase {

    CancellationResult cancel(long bookingId, String actor);
}
