package kr.jemi.boxoffice.hold.domain;

import java.util.List;

/**
 * 선점 요청 결과. 충돌이면 hold는 null이고 conflictedSeatIds에는 경합에서 진 좌석만 담긴다.
 */
public record HoldResult(Hold hold, List<String> conflictedSeatIds) {

    public HoldResult {
        conflictedSeatIds = List.copyOf(conflictedSeatIds);
    }

    public static HoldResult created(Hold hold) {
        return new HoldResult(hold, List.of());
    }

    public static HoldResult conflict(List<String> conflictedSeatIds) {
        return new HoldResult(null, conflictedSeatIds);
    }

    public boolean isCreated() {
        return hold != null;
    }
}
