package kr.jemi.boxoffice.booking.application.port.out;

import kr.jemi.boxoffice.booking.domain.BookedSeat;
import kr.jemi.boxoffice.booking.domain.ShowSchedule;

import java.util.List;
import java.util.Optional;

public interface ShowCatalogPort {

    Optional<ShowSchedule> findSchedule(long showId);

    /**
     * 상영관 전체 좌석의 현재 가격(기본가 + 등급 가격 차이).
     */
    List<BookedSeat> findSeatPrices(long showId);
}
