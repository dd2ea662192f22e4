package kr.jemi.boxoffice.hold.application.service;

import kr.jemi.boxoffice.common.event.ReleaseReason;
import kr.jemi.boxoffice.hold.application.port.out.HoldPort;
import kr.jemi.boxoffice.hold.domain.Hold;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.BDDMockito.given;
import static org.mockito.BDDMockito.then;
import static org.mockito.Mockito.times;

@ExtendWith(MockitoExtension.class)
class HoldSweepServiceTest {

    private static final Instant NOW = Instant.parse("2026-10-19T10:00:00Z");

    @Mock
    private HoldPort holdPort;

    @Mock
    private HoldReleaser holdReleaser;

    private HoldSweepService holdSweepService;

    @BeforeEach
    void setUp() {
        holdSweepService = new HoldSweepService(holdPort, holdReleaser, Clock.fixed(NOW, ZoneOffset.UTC), 2);
    }

    private Hold expiredHold(String token) {
        return Hold.create(token, 1L, List.of("A-" + token), "user-1", NOW.minusSeconds(700), Duration.ofMinutes(10));
    }

    @Test
    @DisplayName("배치가 가득 차면 다음 배치를 이어서 처리한다")
    void sweepUntilShortBatch() {
        // given
        Hold h1 = expiredHold("t1");
        Hold h2 = expiredHold("t2");
        Hold h3 = expiredHold("t3");
        given(holdPort.findExpired(NOW, 2)).willReturn(List.of(h1, h2), List.of(h3));

        // when
        int swept = holdSweepService.sweepExpired();

        // then
        assertThat(swept).isEqualTo(3);
        then(holdReleaser).should().release(h1, ReleaseReason.EXPIRED);
        then(holdReleaser).should().release(h2, ReleaseReason.EXPIRED);
        then(holdReleaser).should().release(h3, ReleaseReason.EXPIRED);
    }

    @Test
    @DisplayName("해제 실패가 있으면 나머지는 계속 처리하고 다음 주기로 넘긴다")
    void stopAfterFailure() {
        // given
        Hold h1 = expiredHold("t1");
        Hold h2 = expiredHold("t2");
        given(holdPort.findExpired(NOW, 2)).willReturn(List.of(h1, h2));
        given(holdReleaser.release(h1, ReleaseReason.EXPIRED)).willThrow(new IllegalStateException("redis down"));

        // when
        int swept = holdSweepService.sweepExpired();

        // then
        assertThat(swept).isEqualTo(1);
        then(holdReleaser).should().release(h2, ReleaseReason.EXPIRED);
        then(holdPort).should(times(1)).findExpired(NOW, 2);
    }

    @Test
    @DisplayName("만료 선점이 없으면 0")
    void nothingExpired() {
        // given
        given(holdPort.findExpired(NOW, 2)).willReturn(List.of());

        // when & then
        assertThat(holdSweepService.sweepExpired()).isZero();
        then(holdReleaser).shouldHaveNoInteractions();
    }
}
