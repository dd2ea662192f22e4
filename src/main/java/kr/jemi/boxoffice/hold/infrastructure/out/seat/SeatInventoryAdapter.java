package kr.jemi.boxoffice.hold.infrastructure.out.seat;

import kr.jemi.boxoffice.hold.application.port.out.SeatInventoryPort;
import kr.jemi.boxoffice.seat.api.SeatFacade;
import kr.jemi.boxoffice.seat.api.SeatReservation;
import kr.jemi.boxoffice.seat.api.SeatTransition;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;

@Component
public class SeatInventoryAdapter implements SeatInventoryPort {

    private final SeatFacade seatFacade;

    public SeatInventoryAdapter(SeatFacade seatFacade) {
        this.seatFacade = seatFacade;
    }

    @Override
    public List<String> reserve(long showId, List<String> seatIds, String holdToken, Instant expiresAt) {
        SeatReservation reservation = seatFacade.reserve(showId, seatIds, holdToken, expiresAt);
        return reservation.reserved() ? List.of() : reservation.conflictedSeatIds();
    }

    @Override
    public boolean release(long showId, List<String> seatIds, String holdToken) {
        return seatFacade.release(showId, seatIds, holdToken) == SeatTransition.APPLIED;
    }

    @Override
    public boolean renew(long showId, List<String> seatIds, String holdToken, Instant newExpiresAt, Instant now) {
        return seatFacade.renew(showId, seatIds, holdToken, newExpiresAt, now) == SeatTransition.APPLIED;
    }
}
