package kr.jemi.boxoffice.booking.application.port.out;

import kr.jemi.boxoffice.booking.domain.FinalizeOutcome;

import java.time.Instant;
import java.util.List;

public interface SeatBookingPort {

    FinalizeOutcome finalizeSeats(long showId, List<String> seatIds, String holdToken,
                                  String bookingCode, Instant now);

    /**
     * @return 예매 좌석을 되돌렸으면 true, 해당 예매 코드로 점유된 좌석이 없으면 false
     */
    boolean freeSeats(long showId, List<String> seatIds, String bookingCode);
}
