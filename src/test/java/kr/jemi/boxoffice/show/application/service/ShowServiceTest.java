package kr.jemi.boxoffice.show.application.service;

import kr.jemi.boxoffice.common.exception.BusinessException;
import kr.jemi.boxoffice.common.exception.ErrorCode;
import kr.jemi.boxoffice.show.api.ShowSeatInfo;
import kr.jemi.boxoffice.show.application.port.out.SeatOccupancyPort;
import kr.jemi.boxoffice.show.application.port.out.ShowPort;
import kr.jemi.boxoffice.show.domain.Availability;
import kr.jemi.boxoffice.show.domain.ScreenSeat;
import kr.jemi.boxoffice.show.domain.SeatAvailability;
import kr.jemi.boxoffice.show.domain.SeatMap;
import kr.jemi.boxoffice.show.domain.Show;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.BDDMockito.given;

@ExtendWith(MockitoExtension.class)
class ShowServiceTest {

    private static final Show SHOW = new Show(1L, "오페라의 유령", 10L,
            Instant.parse("2026-10-20T19:00:00Z"), new BigDecimal("50000"), 3);

    @Mock
    private ShowPort showPort;

    @Mock
    private SeatOccupancyPort seatOccupancyPort;

    @InjectMocks
    private ShowService showService;

    private List<ScreenSeat> screenSeats() {
        return List.of(
                new ScreenSeat("B1", 10L, "R", BigDecimal.ZERO),
                new ScreenSeat("A1", 10L, "VIP", new BigDecimal("20000")),
                new ScreenSeat("C1", 10L, "S", new BigDecimal("-60000"))
        );
    }

    @Nested
    @DisplayName("getSeatMap")
    class GetSeatMap {

        @Test
        @DisplayName("좌석 ID 순으로 등급, 가격, 현재 상태를 합쳐 반환한다")
        void seatMap() {
            // given
            given(showPort.findById(1L)).willReturn(Optional.of(SHOW));
            given(showPort.findSeatsByScreen(10L)).willReturn(screenSeats());
            given(seatOccupancyPort.getAvailabilities(1L, List.of("A1", "B1", "C1")))
                    .willReturn(Map.of("A1", SeatAvailability.BOOKED, "B1", SeatAvailability.HELD,
                            "C1", SeatAvailability.AVAILABLE));

            // when
            SeatMap seatMap = showService.getSeatMap(1L);

            // then
            assertThat(seatMap.seats()).containsExactly(
                    new SeatMap.Entry("A1", "VIP", new BigDecimal("70000"), SeatAvailability.BOOKED),
                    new SeatMap.Entry("B1", "R", new BigDecimal("50000"), SeatAvailability.HELD),
                    new SeatMap.Entry("C1", "S", BigDecimal.ZERO, SeatAvailability.AVAILABLE)
            );
        }

        @Test
        @DisplayName("상영이 없으면 SHOW_NOT_FOUND")
        void showNotFound() {
            // given
            given(showPort.findById(99L)).willReturn(Optional.empty());

            // when & then
            assertThatThrownBy(() -> showService.getSeatMap(99L))
                    .isInstanceOf(BusinessException.class)
                    .extracting(e -> ((BusinessException) e).getErrorCode())
                    .isEqualTo(ErrorCode.SHOW_NOT_FOUND);
        }
    }

    @Test
    @DisplayName("잔여 좌석은 전체 좌석 수에서 예매 카운터를 뺀 값이다")
    void availability() {
        // given
        given(showPort.findById(1L)).willReturn(Optional.of(SHOW));
        given(seatOccupancyPort.countBooked(1L)).willReturn(2L);

        // when
        Availability availability = showService.getAvailability(1L);

        // then
        assertThat(availability.totalSeats()).isEqualTo(3);
        assertThat(availability.booked()).isEqualTo(2);
        assertThat(availability.available()).isEqualTo(1);
    }

    @Test
    @DisplayName("findSeats는 상영이 없으면 빈 목록을 반환한다")
    void findSeatsWithoutShow() {
        // given
        given(showPort.findById(99L)).willReturn(Optional.empty());

        // when & then
        assertThat(showService.findSeats(99L)).isEmpty();
    }

    @Test
    @DisplayName("findSeats는 상영 가격이 반영된 좌석 목록을 반환한다")
    void findSeats() {
        // given
        given(showPort.findById(1L)).willReturn(Optional.of(SHOW));
        given(showPort.findSeatsByScreen(10L)).willReturn(screenSeats());

        // when
        List<ShowSeatInfo> seats = showService.findSeats(1L);

        // then
        assertThat(seats).extracting(ShowSeatInfo::seatId).containsExactly("A1", "B1", "C1");
        assertThat(seats.get(0).price()).isEqualByComparingTo("70000");
    }
}
