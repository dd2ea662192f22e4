package kr.jemi.boxoffice.booking.infrastructure.in.event;

import kr.jemi.boxoffice.booking.application.port.in.SettleRefundUseCase;
import kr.jemi.boxoffice.booking.domain.RefundRequestedEvent;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionalEventListener;

@Component
public class RefundRequestedEventListener {

    private final SettleRefundUseCase settleRefundUseCase;

    public RefundRequestedEventListener(SettleRefundUseCase settleRefundUseCase) {
        this.settleRefundUseCase = settleRefundUseCase;
    }

    @Async
    @TransactionalEventListener
    public void handle(RefundRequestedEvent event) {
        settleRefundUseCase.settle(event.bookingId());
    }
}
