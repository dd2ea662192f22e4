package kr.jemi.boxoffice.booking.application.port.in;

import kr.jemi.boxoffice.booking.domain.BookingResult;

public interface SubmitBookingUseCase {

    BookingResult submit(SubmitBookingCommand command);
}
