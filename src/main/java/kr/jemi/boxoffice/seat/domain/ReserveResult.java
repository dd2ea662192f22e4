package kr.jemi.boxoffice.seat.domain;

import java.util.List;

/**
 * 좌석 묶음 선점 결과. 충돌 좌석이 하나라도 있으면 아무 좌석도 선점되지 않은 것이다.
 */
public record ReserveResult(List<String> conflictedSeatIds) {

    private static final ReserveResult RESERVED = new ReserveResult(List.of());

    public ReserveResult {
        conflictedSeatIds = conflictedSeatIds.stream().sorted().toList();
    }

    public static ReserveResult reserved() {
        return RESERVED;
    }

    public static ReserveResult conflict(List<String> conflictedSeatIds) {
        if (conflictedSeatIds.isEmpty()) {
            throw new IllegalArgumentException("충돌 좌석이 비어 있습니다");
        }
        return new ReserveResult(conflictedSeatIds);
    }

    public boolean isReserved() {
        return conflictedSeatIds.isEmpty();
    }
}
