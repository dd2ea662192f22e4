package kr.jemi.boxoffice.booking.infrastructure.out.seat;

import kr.jemi.boxoffice.booking.application.port.out.SeatBookingPort;
import kr.jemi.boxoffice.booking.domain.FinalizeOutcome;
import kr.jemi.boxoffice.seat.api.SeatFacade;
import kr.jemi.boxoffice.seat.api.SeatTransition;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;

@Component
public class SeatBookingAdapter implements SeatBookingPort {

    private final SeatFacade seatFacade;

    public SeatBookingAdapter(SeatFacade seatFacade) {
        this.seatFacade = seatFacade;
    }

    @Override
    public FinalizeOutcome finalizeSeats(long showId, List<String> seatIds, String holdToken,
                                         String bookingCode, Instant now) {
        SeatTransition transition = seatFacade.finalizeBooking(showId, seatIds, holdToken, bookingCode, now);
        return switch (transition) {
            case APPLIED -> FinalizeOutcome.FINALIZED;
            case EXPIRED -> FinalizeOutcome.EXPIRED;
            case NOT_FOUND -> FinalizeOutcome.NOT_FOUND;
        };
    }

    @Override
    public boolean freeSeats(long showId, List<String> seatIds, String bookingCode) {
        return seatFacade.free(showId, seatIds, bookingCode) == SeatTransition.APPLIED;
    }
}
