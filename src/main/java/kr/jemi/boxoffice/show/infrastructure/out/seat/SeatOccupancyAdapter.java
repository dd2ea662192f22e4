package kr.jemi.boxoffice.show.infrastructure.out.seat;

import kr.jemi.boxoffice.seat.api.SeatFacade;
import kr.jemi.boxoffice.seat.api.SeatOccupancy;
import kr.jemi.boxoffice.show.application.port.out.SeatOccupancyPort;
import kr.jemi.boxoffice.show.domain.SeatAvailability;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Component
public class SeatOccupancyAdapter implements SeatOccupancyPort {

    private final SeatFacade seatFacade;

    public SeatOccupancyAdapter(SeatFacade seatFacade) {
        this.seatFacade = seatFacade;
    }

    @Override
    public Map<String, SeatAvailability> getAvailabilities(long showId, List<String> seatIds) {
        Map<String, SeatAvailability> result = new LinkedHashMap<>();
        seatFacade.getOccupancies(showId, seatIds)
                .forEach((seatId, occupancy) -> result.put(seatId, toAvailability(occupancy)));
        return result;
    }

    @Override
    public long countBooked(long showId) {
        return seatFacade.countBooked(showId);
    }

    private SeatAvailability toAvailability(SeatOccupancy occupancy) {
        return switch (occupancy) {
            case AVAILABLE -> SeatAvailability.AVAILABLE;
            case HELD -> SeatAvailability.HELD;
            case BOOKED -> SeatAvailability.BOOKED;
        };
    }
}
