package kr.jemi.boxoffice.booking.application.port.in;

import kr.jemi.boxoffice.booking.domain.Booking;

public interface GetBookingUseCase {

    Booking getBooking(long bookingId);

    Booking getBookingByCode(String code);
}
