package kr.jemi.boxoffice.booking.application.port.in;

import java.util.List;

public interface ReleaseCancelledSeatsUseCase {

    void release(long showId, List<String> seatIds, String bookingCode);
}
