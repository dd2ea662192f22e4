package kr.jemi.boxoffice.booking.application.service;

import kr.jemi.boxoffice.booking.application.port.in.GetBookingUseCase;
import kr.jemi.boxoffice.booking.application.port.out.BookingPort;
import kr.jemi.boxoffice.booking.domain.Booking;
import kr.jemi.boxoffice.common.exception.BusinessException;
import kr.jemi.boxoffice.common.exception.ErrorCode;
import org.springframework.stereotype.Service;

@Service
public class BookingQueryService implements GetBookingUseCase {

    private final BookingPort bookingPort;

    public BookingQueryService(BookingPort bookingPort) {
        this.bookingPort = bookingPort;
    }

    @Override
    public Booking getBooking(long bookingId) {
        return bookingPort.findById(bookingId)
                .orElseThrow(() -> new BusinessException(ErrorCode.BOOKING_NOT_FOUND));
    }

    @Override
    public Booking getBookingByCode(String code) {
        return bookingPort.findByCode(code)
                .orElseThrow(() -> new BusinessException(ErrorCode.BOOKING_NOT_FOUND));
    }
}
