package kr.jemi.boxoffice.show.application.port.out;

import kr.jemi.boxoffice.show.domain.SeatAvailability;

import java.util.List;
import java.util.Map;

public interface SeatOccupancyPort {

    Map<String, SeatAvailability> getAvailabilities(long showId, List<String> seatIds);

    long countBooked(long showId);
}
