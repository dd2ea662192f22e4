package kr.jemi.boxoffice.show.application.service;

import kr.jemi.boxoffice.common.exception.BusinessException;
import kr.jemi.boxoffice.common.exception.ErrorCode;
import kr.jemi.boxoffice.show.api.ShowFacade;
import kr.jemi.boxoffice.show.api.ShowInfo;
import kr.jemi.boxoffice.show.api.ShowSeatInfo;
import kr.jemi.boxoffice.show.application.port.in.GetAvailabilityUseCase;
import kr.jemi.boxoffice.show.application.port.in.GetSeatMapUseCase;
import kr.jemi.boxoffice.show.application.port.out.SeatOccupancyPort;
import kr.jemi.boxoffice.show.application.port.out.ShowPort;
import kr.jemi.boxoffice.show.domain.Availability;
import kr.jemi.boxoffice.show.domain.ScreenSeat;
import kr.jemi.boxoffice.show.domain.SeatAvailability;
import kr.jemi.boxoffice.show.domain.SeatMap;
import kr.jemi.boxoffice.show.domain.Show;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Service;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Service
public class ShowService implements GetSeatMapUseCase, GetAvailabilityUseCase, ShowFacade {

    private final ShowPort showPort;
    private final SeatOccupancyPort seatOccupancyPort;

    public ShowService(ShowPort showPort, SeatOccupancyPort seatOccupancyPort) {
        this.showPort = showPort;
        this.seatOccupancyPort = seatOccupancyPort;
    }

    @Override
    public SeatMap getSeatMap(long showId) {
        Show show = getShow(showId);
        List<ScreenSeat> seats = sortedSeats(show);
        Map<String, SeatAvailability> availabilities = seatOccupancyPort.getAvailabilities(
                showId, seats.stream().map(ScreenSeat::seatId).toList());
        List<SeatMap.Entry> entries = seats.stream()
                .map(seat -> new SeatMap.Entry(seat.seatId(), seat.tier(), seat.priceOn(show),
                        availabilities.getOrDefault(seat.seatId(), SeatAvailability.AVAILABLE)))
                .toList();
        return new SeatMap(showId, entries);
    }

    @Override
    public Availability getAvailability(long showId) {
        Show show = getShow(showId);
        return new Availability(showId, show.totalSeats(), seatOccupancyPort.countBooked(showId));
    }

    @Override
    @Cacheable(value = "shows", key = "#showId")
    public Optional<ShowInfo> findShow(long showId) {
        return showPort.findById(showId)
                .map(show -> new ShowInfo(show.id(), show.screenId(), show.scheduledAt(),
                        show.basePrice(), show.totalSeats()));
    }

    @Override
    @Cacheable(value = "showSeats", key = "#showId")
    public List<ShowSeatInfo> findSeats(long showId) {
        return showPort.findById(showId)
                .map(show -> sortedSeats(show).stream()
                        .map(seat -> new ShowSeatInfo(seat.seatId(), seat.tier(), seat.priceOn(show)))
                        .toList())
                .orElse(List.of());
    }

    private Show getShow(long showId) {
        return showPort.findById(showId)
                .orElseThrow(() -> new BusinessException(ErrorCode.SHOW_NOT_FOUND));
    }

    private List<ScreenSeat> sortedSeats(Show show) {
        return showPort.findSeatsByScreen(show.screenId()).stream()
                .sorted(Comparator.comparing(ScreenSeat::seatId))
                .toList();
    }
}
