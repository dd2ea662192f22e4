package kr.jemi.boxoffice.booking.infrastructure.in.event;

import kr.jemi.boxoffice.booking.application.port.in.ReleaseCancelledSeatsUseCase;
import kr.jemi.boxoffice.common.event.BookingCancelledEvent;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionalEventListener;

@Component
public class BookingCancelledEventListener {

    private final ReleaseCancelledSeatsUseCase releaseCancelledSeatsUseCase;

    public BookingCancelledEventListener(ReleaseCancelledSeatsUseCase releaseCancelledSeatsUseCase) {
        this.releaseCancelledSeatsUseCase = releaseCancelledSeatsUseCase;
    }

    @Async
    @TransactionalEventListener
    public void handle(BookingCancelledEvent event) {
        releaseCancelledSeatsUseCase.release(event.showId(), event.seatIds(), event.bookingCode());
    }
}
