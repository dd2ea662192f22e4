package kr.jemi.boxoffice.show.application.port.out;

import kr.jemi.boxoffice.show.domain.ScreenSeat;
import kr.jemi.boxoffice.show.domain.Show;

import java.util.List;
import java.util.Optional;

public interface ShowPort {

    Optional<Show> findById(long showId);

    List<ScreenSeat> findSeatsByScreen(long screenId);
}
