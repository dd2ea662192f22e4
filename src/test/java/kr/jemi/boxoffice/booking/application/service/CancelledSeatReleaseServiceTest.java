package kr.jemi.boxoffice.booking.application.service;

import kr.jemi.boxoffice.booking.application.port.out.SeatBookingPort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.RedisConnectionFailureException;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.BDDMockito.given;
import static org.mockito.BDDMockito.then;

@ExtendWith(MockitoExtension.class)
class CancelledSeatReleaseServiceTest {

    @Mock
    private SeatBookingPort seatBookingPort;

    private CancelledSeatReleaseService cancelledSeatReleaseService;

    @BeforeEach
    void setUp() {
        cancelledSeatReleaseService = new CancelledSeatReleaseService(seatBookingPort);
    }

    @Test
    @DisplayName("취소된 예매 코드로 점유된 좌석을 되돌린다")
    void release() {
        // given
        given(seatBookingPort.freeSeats(1L, List.of("A1", "A2"), "BK0001")).willReturn(true);

        // when
        cancelledSeatReleaseService.release(1L, List.of("A1", "A2"), "BK0001");

        // then
        then(seatBookingPort).should().freeSeats(1L, List.of("A1", "A2"), "BK0001");
    }

    @Test
    @DisplayName("재발행으로 다시 들어와 이미 풀린 좌석이면 예외 없이 넘어간다")
    void alreadyFreed() {
        // given
        given(seatBookingPort.freeSeats(1L, List.of("A1"), "BK0001")).willReturn(false);

        // when & then
        assertThatCode(() -> cancelledSeatReleaseService.release(1L, List.of("A1"), "BK0001"))
                .doesNotThrowAnyException();
    }

    @Test
    @DisplayName("좌석 저장소 오류는 그대로 던져 재발행 대상으로 남긴다")
    void storeFailure() {
        // given
        given(seatBookingPort.freeSeats(1L, List.of("A1"), "BK0001"))
                .willThrow(new RedisConnectionFailureException("down"));

        // when & then
        assertThatThrownBy(() -> cancelledSeatReleaseService.release(1L, List.of("A1"), "BK0001"))
                .isInstanceOf(RedisConnectionFailureException.class);
    }
}
