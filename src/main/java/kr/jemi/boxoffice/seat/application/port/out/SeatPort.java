package kr.jemi.boxoffice.seat.application.port.out;

import kr.jemi.boxoffice.seat.domain.ReserveResult;
import kr.jemi.boxoffice.seat.domain.SeatStates;
import kr.jemi.boxoffice.seat.domain.TransitionResult;

import java.time.Instant;
import java.util.List;

/**
 * 상영별 좌석 상태 저장소. 모든 변경은 좌석 묶음 단위로 원자적이다.
 */
public interface SeatPort {

    ReserveResult reserveSeats(long showId, List<String> seatIds, String holdToken, Instant expiresAt);

    TransitionResult releaseSeats(long showId, List<String> seatIds, String holdToken);

    TransitionResult renewSeats(long showId, List<String> seatIds, String holdToken,
                                Instant newExpiresAt, Instant now);

    /**
     * HELD → BOOKED 전이와 예매 좌석 카운터 증가를 한 번에 수행한다.
     * now 기준으로 선점이 만료되었으면 아무것도 바꾸지 않고 EXPIRED를 반환한다.
     */
    TransitionResult finalizeSeats(long showId, List<String> seatIds, String holdToken,
                                   String bookingCode, Instant now);

    TransitionResult freeSeats(long showId, List<String> seatIds, String bookingCode);

    SeatStates getStates(long showId, List<String> seatIds);

    long countBooked(long showId);
}
