package kr.jemi.boxoffice.hold.application.port.in;

import kr.jemi.boxoffice.hold.domain.Hold;

public interface ExtendHoldUseCase {

    Hold extendHold(String token, String actor);
}
