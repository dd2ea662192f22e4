package kr.jemi.boxoffice.hold.application.port.in;

import kr.jemi.boxoffice.hold.domain.HoldResult;

import java.util.List;

public interface CreateHoldUseCase {

    HoldResult createHold(long showId, List<String> seatIds, String actor);
}
