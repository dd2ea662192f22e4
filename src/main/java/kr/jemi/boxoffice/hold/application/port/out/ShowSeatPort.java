package kr.jemi.boxoffice.hold.application.port.out;

import java.util.Optional;
import java.util.Set;

public interface ShowSeatPort {

    /**
     * @return 상영관 좌석 ID 집합. 상영이 없으면 empty
     */
    Optional<Set<String>> findSeatIds(long showId);
}
