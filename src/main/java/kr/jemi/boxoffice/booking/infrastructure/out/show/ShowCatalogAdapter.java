package kr.jemi.boxoffice.booking.infrastructure.out.show;

import kr.jemi.boxoffice.booking.application.port.out.ShowCatalogPort;
import kr.jemi.boxoffice.booking.domain.BookedSeat;
import kr.jemi.boxoffice.booking.domain.ShowSchedule;
import kr.jemi.boxoffice.show.api.ShowFacade;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

@Component
public class ShowCatalogAdapter implements ShowCatalogPort {

    private final ShowFacade showFacade;

    public ShowCatalogAdapter(ShowFacade showFacade) {
        this.showFacade = showFacade;
    }

    @Override
    public Optional<ShowSchedule> findSchedule(long showId) {
        return showFacade.findShow(showId)
                .map(show -> new ShowSchedule(show.showId(), show.scheduledAt()));
    }

    @Override
    public List<BookedSeat> findSeatPrices(long showId) {
        return showFacade.findSeats(showId).stream()
                .map(seat -> new BookedSeat(seat.seatId(), seat.tier(), seat.price()))
                .toList();
    }
}
