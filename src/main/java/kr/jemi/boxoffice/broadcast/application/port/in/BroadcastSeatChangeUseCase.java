package kr.jemi.boxoffice.broadcast.application.port.in;

import kr.jemi.boxoffice.broadcast.domain.SeatChange;

public interface BroadcastSeatChangeUseCase {

    void broadcast(SeatChange change);
}
