package kr.jemi.boxoffice.show.application.port.in;

import kr.jemi.boxoffice.show.domain.Availability;

public interface GetAvailabilityUseCase {

    Availability getAvailability(long showId);
}
