package kr.jemi.boxoffice.seat.application.service;

import kr.jemi.boxoffice.seat.api.SeatFacade;
import kr.jemi.boxoffice.seat.api.SeatOccupancy;
import kr.jemi.boxoffice.seat.api.SeatReservation;
import kr.jemi.boxoffice.seat.api.SeatTransition;
import kr.jemi.boxoffice.seat.application.port.out.SeatPort;
import kr.jemi.boxoffice.seat.domain.ReserveResult;
import kr.jemi.boxoffice.seat.domain.SeatStates;
import kr.jemi.boxoffice.seat.domain.TransitionResult;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Service
public class SeatService implements SeatFacade {

    private final SeatPort seatPort;

    public SeatService(SeatPort seatPort) {
        this.seatPort = seatPort;
    }

    @Override
    public SeatReservation reserve(long showId, List<String> seatIds, String holdToken, Instant expiresAt) {
        ReserveResult result = seatPort.reserveSeats(showId, seatIds, holdToken, expiresAt);
        return new SeatReservation(result.isReserved(), result.conflictedSeatIds());
    }

    @Override
    public SeatTransition release(long showId, List<String> seatIds, String holdToken) {
        return toTransition(seatPort.releaseSeats(showId, seatIds, holdToken));
    }

    @Override
    public SeatTransition renew(long showId, List<String> seatIds, String holdToken,
                                Instant newExpiresAt, Instant now) {
        return toTransition(seatPort.renewSeats(showId, seatIds, holdToken, newExpiresAt, now));
    }

    @Override
    public SeatTransition finalizeBooking(long showId, List<String> seatIds, String holdToken,
                                          String bookingCode, Instant now) {
        return toTransition(seatPort.finalizeSeats(showId, seatIds, holdToken, bookingCode, now));
    }

    @Override
    public SeatTransition free(long showId, List<String> seatIds, String bookingCode) {
        return toTransition(seatPort.freeSeats(showId, seatIds, bookingCode));
    }

    @Override
    public Map<String, SeatOccupancy> getOccupancies(long showId, List<String> seatIds) {
        SeatStates states = seatPort.getStates(showId, seatIds);
        Map<String, SeatOccupancy> occupancies = new LinkedHashMap<>();
        for (String seatId : seatIds) {
            occupancies.put(seatId, SeatOccupancy.valueOf(states.of(seatId).status().name()));
        }
        return occupancies;
    }

    @Override
    public long countBooked(long showId) {
        return seatPort.countBooked(showId);
    }

    private SeatTransition toTransition(TransitionResult result) {
        return switch (result) {
            case APPLIED -> SeatTransition.APPLIED;
            case EXPIRED -> SeatTransition.EXPIRED;
            case NOT_FOUND -> SeatTransition.NOT_FOUND;
        };
    }
}
