package kr.jemi.boxoffice.seat.api;

import java.time.Instant;
import java.util.List;
import java.util.Map;

public interface SeatFacade {

    SeatReservation reserve(long showId, List<String> seatIds, String holdToken, Instant expiresAt);

    SeatTransition release(long showId, List<String> seatIds, String holdToken);

    SeatTransition renew(long showId, List<String> seatIds, String holdToken, Instant newExpiresAt, Instant now);

    SeatTransition finalizeBooking(long showId, List<String> seatIds, String holdToken,
                                   String bookingCode, Instant now);

    SeatTransition free(long showId, List<String> seatIds, String bookingCode);

    Map<String, SeatOccupancy> getOccupancies(long showId, List<String> seatIds);

    long countBooked(long showId);
}
