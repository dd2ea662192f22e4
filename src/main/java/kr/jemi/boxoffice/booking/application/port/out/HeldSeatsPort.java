package kr.jemi.boxoffice.booking.application.port.out;

import kr.jemi.boxoffice.booking.domain.HeldSeats;
import kr.jemi.boxoffice.common.event.ReleaseReason;

import java.util.Optional;

public interface HeldSeatsPort {

    Optional<HeldSeats> findHold(String holdToken);

    void consume(String holdToken);

    void release(String holdToken, ReleaseReason reason);
}
