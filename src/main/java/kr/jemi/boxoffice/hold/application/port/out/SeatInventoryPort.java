package kr.jemi.boxoffice.hold.application.port.out;

import java.time.Instant;
import java.util.List;

public interface SeatInventoryPort {

    /**
     * 좌석 묶음 전체를 선점한다.
     *
     * @return 이미 점유된 좌석 ID 목록. 비어 있으면 전체 선점에 성공한 것이다.
     */
    List<String> reserve(long showId, List<String> seatIds, String holdToken, Instant expiresAt);

    /**
     * @return 선점 좌석을 해제했으면 true, 해당 토큰이 소유한 좌석이 없으면 false
     */
    boolean release(long showId, List<String> seatIds, String holdToken);

    /**
     * @return 연장했으면 true, 이미 만료되었거나 소유 좌석이 없으면 false
     */
    boolean renew(long showId, List<String> seatIds, String holdToken, Instant newExpiresAt, Instant now);
}
