package kr.jemi.boxoffice.booking.infrastructure.in.web.dto;

import kr.jemi.boxoffice.booking.domain.Booking;
import kr.jemi.boxoffice.common.exception.ErrorCode;

public record BookingFailureResponse(int status, String code, String message,
                                     String bookingCode, String failureReason) {

    public static BookingFailureResponse of(ErrorCode errorCode, Booking booking, String failureReason) {
        return new BookingFailureResponse(errorCode.getStatus().value(), errorCode.name(),
                errorCode.getMessage(), booking != null ? booking.getCode() : null, failureReason);
    }
}
