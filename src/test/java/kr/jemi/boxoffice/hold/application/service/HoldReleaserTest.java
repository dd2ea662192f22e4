package kr.jemi.boxoffice.hold.application.service;

import kr.jemi.boxoffice.common.event.ReleaseReason;
import kr.jemi.boxoffice.common.event.SeatsReleasedEvent;
import kr.jemi.boxoffice.hold.application.port.out.HoldPort;
import kr.jemi.boxoffice.hold.application.port.out.SeatInventoryPort;
import kr.jemi.boxoffice.hold.domain.Hold;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.BDDMockito.given;
import static org.mockito.BDDMockito.then;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;

@ExtendWith(MockitoExtension.class)
class HoldReleaserTest {

    private static final Instant NOW = Instant.parse("2026-10-19T10:00:00Z");

    @Mock
    private HoldPort holdPort;

    @Mock
    private SeatInventoryPort seatInventoryPort;

    @Mock
    private ApplicationEventPublisher eventPublisher;

    private HoldReleaser holdReleaser;

    private final Hold hold = Hold.create("token-1", 1L, List.of("A1"), "user-1",
            NOW.minusSeconds(600), Duration.ofMinutes(10));

    @BeforeEach
    void setUp() {
        holdReleaser = new HoldReleaser(holdPort, seatInventoryPort, eventPublisher, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    @DisplayName("좌석을 먼저 되돌리고 기록을 지운 뒤 SeatsReleased 이벤트를 발행한다")
    void releaseInOrder() {
        // given
        given(seatInventoryPort.release(1L, List.of("A1"), "token-1")).willReturn(true);

        // when
        boolean released = holdReleaser.release(hold, ReleaseReason.EXPIRED);

        // then
        assertThat(released).isTrue();
        InOrder order = inOrder(seatInventoryPort, holdPort, eventPublisher);
        order.verify(seatInventoryPort).release(1L, List.of("A1"), "token-1");
        order.verify(holdPort).delete("token-1");
        order.verify(eventPublisher).publishEvent(new SeatsReleasedEvent(
                1L, List.of("A1"), "token-1", ReleaseReason.EXPIRED, NOW));
    }

    @Test
    @DisplayName("좌석이 이미 예매되었거나 해제되었으면 기록만 지우고 이벤트는 발행하지 않는다")
    void nothingToRelease() {
        // given
        given(seatInventoryPort.release(1L, List.of("A1"), "token-1")).willReturn(false);

        // when
        boolean released = holdReleaser.release(hold, ReleaseReason.EXPIRED);

        // then
        assertThat(released).isFalse();
        then(holdPort).should().delete("token-1");
        then(eventPublisher).shouldHaveNoInteractions();
    }

    @Test
    @DisplayName("좌석 해제에 실패하면 기록을 남겨 다음 스윕이 재시도하게 한다")
    void keepRecordOnFailure() {
        // given
        given(seatInventoryPort.release(1L, List.of("A1"), "token-1"))
                .willThrow(new IllegalStateException("redis down"));

        // when & then
        assertThatThrownBy(() -> holdReleaser.release(hold, ReleaseReason.EXPIRED))
                .isInstanceOf(IllegalStateException.class);
        then(holdPort).should(never()).delete("token-1");
    }
}
