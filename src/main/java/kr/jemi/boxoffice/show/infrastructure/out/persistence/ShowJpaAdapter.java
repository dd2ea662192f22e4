package kr.jemi.boxoffice.show.infrastructure.out.persistence;

import kr.jemi.boxoffice.show.application.port.out.ShowPort;
import kr.jemi.boxoffice.show.domain.ScreenSeat;
import kr.jemi.boxoffice.show.domain.Show;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

@Component
public class ShowJpaAdapter implements ShowPort {

    private final ShowJpaRepository showRepository;
    private final ScreenSeatJpaRepository screenSeatRepository;

    public ShowJpaAdapter(ShowJpaRepository showRepository, ScreenSeatJpaRepository screenSeatRepository) {
        this.showRepository = showRepository;
        this.screenSeatRepository = screenSeatRepository;
    }

    @Override
    public Optional<Show> findById(long showId) {
        return showRepository.findById(showId).map(ShowJpaEntity::toDomain);
    }

    @Override
    public List<ScreenSeat> findSeatsByScreen(long screenId) {
        return screenSeatRepository.findByScreenId(screenId).stream()
                .map(ScreenSeatJpaEntity::toDomain)
                .toList();
    }
}
