package kr.jemi.boxoffice.hold.api;

import kr.jemi.boxoffice.common.event.ReleaseReason;

import java.util.Optional;

public interface HoldFacade {

    Optional<HoldView> findHold(String token);

    /**
     * 예매로 전환된 선점 기록을 삭제한다. 좌석 상태는 건드리지 않는다.
     */
    void consume(String token);

    /**
     * 선점 좌석을 되돌리고 선점 기록을 삭제한다. 이미 사라진 선점이면 아무것도 하지 않는다.
     */
    void release(String token, ReleaseReason reason);
}
