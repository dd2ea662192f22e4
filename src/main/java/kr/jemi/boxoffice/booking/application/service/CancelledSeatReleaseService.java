package kr.jemi.boxoffice.booking.application.service;

import kr.jemi.boxoffice.booking.application.port.in.ReleaseCancelledSeatsUseCase;
import kr.jemi.boxoffice.booking.application.port.out.SeatBookingPort;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * 취소가 커밋된 예매의 좌석을 되돌린다. 좌석 저장소 오류는 그대로 던져 이벤트 발행 기록이 미완료로 남고
 * 재발행 스케줄러가 다시 시도한다. 이미 풀린 좌석이면 경고만 남기므로 재시도해도 안전하다.
 */
@Service
public class CancelledSeatReleaseService implements ReleaseCancelledSeatsUseCase {

    private static final Logger log = LoggerFactory.getLogger(CancelledSeatReleaseService.class);

    private final SeatBookingPort seatBookingPort;

    public CancelledSeatReleaseService(SeatBookingPort seatBookingPort) {
        this.seatBookingPort = seatBookingPort;
    }

    @Override
    public void release(long showId, List<String> seatIds, String bookingCode) {
        if (!seatBookingPort.freeSeats(showId, seatIds, bookingCode)) {
            log.warn("취소 좌석 반환 대상 없음: code={}, seats={}", bookingCode, seatIds);
            return;
        }
        log.info("취소 좌석 반환: code={}, seats={}", bookingCode, seatIds);
    }
}
