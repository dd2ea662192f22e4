package kr.jemi.boxoffice.hold.infrastructure.in.web.dto;

import kr.jemi.boxoffice.common.exception.ErrorCode;

import java.util.List;

public record SeatConflictResponse(int status, String code, String message, List<String> conflictedSeatIds) {

    public static SeatConflictResponse of(List<String> conflictedSeatIds) {
        ErrorCode errorCode = ErrorCode.SEAT_CONFLICT;
        return new SeatConflictResponse(errorCode.getStatus().value(), errorCode.name(),
                errorCode.getMessage(), conflictedSeatIds);
    }
}
