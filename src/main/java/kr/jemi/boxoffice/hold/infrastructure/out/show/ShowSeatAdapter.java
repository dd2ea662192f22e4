package kr.jemi.boxoffice.hold.infrastructure.out.show;

import kr.jemi.boxoffice.hold.application.port.out.ShowSeatPort;
import kr.jemi.boxoffice.show.api.ShowFacade;
import kr.jemi.boxoffice.show.api.ShowSeatInfo;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

@Component
public class ShowSeatAdapter implements ShowSeatPort {

    private final ShowFacade showFacade;

    public ShowSeatAdapter(ShowFacade showFacade) {
        this.showFacade = showFacade;
    }

    @Override
    public Optional<Set<String>> findSeatIds(long showId) {
        return showFacade.findShow(showId)
                .map(show -> showFacade.findSeats(showId).stream()
                        .map(ShowSeatInfo::seatId)
                        .collect(Collectors.toSet()));
    }
}
