package kr.jemi.boxoffice.show.api;

import java.util.List;
import java.util.Optional;

public interface ShowFacade {

    Optional<ShowInfo> findShow(long showId);

    /**
     * 상영관의 전체 좌석을 좌석 ID 순으로 반환한다. 상영이 없으면 빈 목록이다.
     */
    List<ShowSeatInfo> findSeats(long showId);
}
