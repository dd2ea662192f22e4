package kr.jemi.boxoffice.show.application.port.in;

import kr.jemi.boxoffice.show.domain.SeatMap;

public interface GetSeatMapUseCase {

    SeatMap getSeatMap(long showId);
}
