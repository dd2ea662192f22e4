package kr.jemi.boxoffice.broadcast.application.port.in;

import kr.jemi.boxoffice.broadcast.domain.SeatChangeSubscriber;

public interface SubscribeSeatChangesUseCase {

    void subscribe(long showId, SeatChangeSubscriber subscriber);

    void unsubscribe(long showId, SeatChangeSubscriber subscriber);
}
