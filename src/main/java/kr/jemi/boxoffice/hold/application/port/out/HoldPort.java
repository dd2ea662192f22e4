package kr.jemi.boxoffice.hold.application.port.out;

import kr.jemi.boxoffice.hold.domain.Hold;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface HoldPort {

    void save(Hold hold);

    Optional<Hold> findByToken(String token);

    void delete(String token);

    /**
     * 만료 시각이 now 이하인 선점을 만료 시각 순으로 최대 limit개 조회한다.
     */
    List<Hold> findExpired(Instant now, int limit);
}
