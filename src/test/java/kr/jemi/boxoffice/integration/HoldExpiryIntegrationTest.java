package kr.jemi.boxoffice.integration;

import kr.jemi.boxoffice.booking.application.port.in.SubmitBookingCommand;
import kr.jemi.boxoffice.booking.application.port.in.SubmitBookingUseCase;
import kr.jemi.boxoffice.booking.domain.BookingOutcome;
import kr.jemi.boxoffice.hold.application.port.in.CreateHoldUseCase;
import kr.jemi.boxoffice.hold.application.port.in.ReleaseHoldUseCase;
import kr.jemi.boxoffice.hold.domain.HoldResult;
import kr.jemi.boxoffice.show.application.port.in.GetSeatMapUseCase;
import kr.jemi.boxoffice.show.domain.SeatAvailability;
import kr.jemi.boxoffice.show.domain.SeatMap;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.util.List;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;
import static org.mockito.BDDMockito.then;

class HoldExpiryIntegrationTest extends IntegrationTestBase {

    private static final long SHOW_ID = 2L;

    @Autowired
    CreateHoldUseCase createHoldUseCase;

    @Autowired
    ReleaseHoldUseCase releaseHoldUseCase;

    @Autowired
    SubmitBookingUseCase submitBookingUseCase;

    @Autowired
    GetSeatMapUseCase getSeatMapUseCase;

    @Test
    @DisplayName("선점 TTL(3초)이 지나면 스윕이 좌석을 풀고 다른 사용자가 선점할 수 있다")
    void expired_hold_is_swept() {
        seedShow(SHOW_ID, "B1", "B2");
        HoldResult x = createHoldUseCase.createHold(SHOW_ID, List.of("B1", "B2"), "user-x");
        assertThat(x.isCreated()).isTrue();
        assertThat(createHoldUseCase.createHold(SHOW_ID, List.of("B1"), "user-y").isCreated())
                .as("만료 전에는 충돌").isFalse();

        await().atMost(6, TimeUnit.SECONDS).untilAsserted(() ->
                assertThat(getSeatMapUseCase.getSeatMap(SHOW_ID).seats())
                        .as("스윕 후 좌석 복구")
                        .extracting(SeatMap.Entry::availability)
                        .containsOnly(SeatAvailability.AVAILABLE)
        );

        assertThat(createHoldUseCase.createHold(SHOW_ID, List.of("B1"), "user-y").isCreated())
                .as("만료 후 재선점").isTrue();
    }

    @Test
    @DisplayName("만료된 선점으로 제출하면 결제 없이 HOLD_EXPIRED")
    void submit_after_expiry() {
        seedShow(SHOW_ID, "B1");
        HoldResult x = createHoldUseCase.createHold(SHOW_ID, List.of("B1"), "user-x");

        await().atMost(6, TimeUnit.SECONDS).untilAsserted(() ->
                assertThat(getSeatMapUseCase.getSeatMap(SHOW_ID).seats())
                        .extracting(SeatMap.Entry::availability)
                        .containsOnly(SeatAvailability.AVAILABLE)
        );

        assertThat(submitBookingUseCase.submit(
                new SubmitBookingCommand(x.hold().token(), "user-x", "CARD", null)).outcome())
                .isEqualTo(BookingOutcome.HOLD_EXPIRED);
        then(paymentPort).shouldHaveNoInteractions();
        assertThat(bookingJpaRepository.count()).isZero();
    }

    @Test
    @DisplayName("직접 해제한 선점의 좌석은 즉시 풀린다")
    void release_frees_seats_immediately() {
        seedShow(SHOW_ID, "B1");
        HoldResult x = createHoldUseCase.createHold(SHOW_ID, List.of("B1"), "user-x");

        releaseHoldUseCase.releaseHold(x.hold().token(), "user-x");

        assertThat(createHoldUseCase.createHold(SHOW_ID, List.of("B1"), "user-y").isCreated()).isTrue();
    }
}
