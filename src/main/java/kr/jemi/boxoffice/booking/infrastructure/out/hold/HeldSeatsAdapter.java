package kr.jemi.boxoffice.booking.infrastructure.out.hold;

import kr.jemi.boxoffice.booking.application.port.out.HeldSeatsPort;
import kr.jemi.boxoffice.booking.domain.HeldSeats;
import kr.jemi.boxoffice.common.event.ReleaseReason;
import kr.jemi.boxoffice.hold.api.HoldFacade;
import org.springframework.stereotype.Component;

import java.util.Optional;

@Component
public class HeldSeatsAdapter implements HeldSeatsPort {

    private final HoldFacade holdFacade;

    public HeldSeatsAdapter(HoldFacade holdFacade) {
        this.holdFacade = holdFacade;
    }

    @Override
    public Optional<HeldSeats> findHold(String holdToken) {
        return holdFacade.findHold(holdToken)
                .map(hold -> new HeldSeats(hold.token(), hold.showId(), hold.seatIds(),
                        hold.actor(), hold.expiresAt()));
    }

    @Override
    public void consume(String holdToken) {
        holdFacade.consume(holdToken);
    }

    @Override
    public void release(String holdToken, ReleaseReason reason) {
        holdFacade.release(holdToken, reason);
    }
}
