package kr.jemi.boxoffice.booking.infrastructure.in.web;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import kr.jemi.boxoffice.booking.application.port.in.CancelBookingUseCase;
import kr.jemi.boxoffice.booking.application.port.in.GetBookingUseCase;
import kr.jemi.boxoffice.booking.application.port.in.SubmitBookingCommand;
import kr.jemi.boxoffice.booking.application.port.in.SubmitBookingUseCase;
import kr.jemi.boxoffice.booking.domain.BookingResult;
import kr.jemi.boxoffice.booking.domain.CancellationResult;
import kr.jemi.boxoffice.booking.infrastructure.in.web.dto.BookingFailureResponse;
import kr.jemi.boxoffice.booking.infrastructure.in.web.dto.BookingResponse;
import kr.jemi.boxoffice.booking.infrastructure.in.web.dto.CancellationResponse;
import kr.jemi.boxoffice.booking.infrastructure.in.web.dto.SubmitBookingRequest;
import kr.jemi.boxoffice.common.dto.ErrorResponse;
import kr.jemi.boxoffice.common.exception.ErrorCode;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RestController;

@Tag(name = "Booking", description = "예매 및 취소")
@RestController
public class BookingApiController {

    private final SubmitBookingUseCase submitBookingUseCase;
    private final CancelBookingUseCase cancelBookingUseCase;
    private final GetBookingUseCase getBookingUseCase;

    public BookingApiController(SubmitBookingUseCase submitBookingUseCase,
                                CancelBookingUseCase cancelBookingUseCase,
                                GetBookingUseCase getBookingUseCase) {
        this.submitBookingUseCase = submitBookingUseCase;
        this.cancelBookingUseCase = cancelBookingUseCase;
        this.getBookingUseCase = getBookingUseCase;
    }

    @Operation(summary = "예매 제출", description = "선점한 좌석을 결제하고 예매를 확정합니다. 같은 선점으로 다시 제출하면 기존 결과를 반환합니다.")
    @PostMapping("/api/bookings")
    public ResponseEntity<?> submit(
            @Parameter(description = "요청자 ID") @RequestHeader("X-Actor-Id") String actor,
            @Valid @RequestBody SubmitBookingRequest request) {
        BookingResult result = submitBookingUseCase.submit(new SubmitBookingCommand(
                request.holdToken(), actor, request.paymentMethod(), request.promoCode()));
        return switch (result.outcome()) {
            case CONFIRMED -> ResponseEntity.status(HttpStatus.CREATED).body(BookingResponse.from(result.booking()));
            case HOLD_EXPIRED -> failure(ErrorCode.HOLD_EXPIRED, result);
            case PAYMENT_FAILED -> failure(ErrorCode.PAYMENT_FAILED, result);
            case IN_PROGRESS -> failure(ErrorCode.BOOKING_IN_PROGRESS, result);
        };
    }

    @Operation(summary = "예매 조회")
    @GetMapping("/api/bookings/{bookingId}")
    public ResponseEntity<BookingResponse> getBooking(@PathVariable long bookingId) {
        return ResponseEntity.ok(BookingResponse.from(getBookingUseCase.getBooking(bookingId)));
    }

    @Operation(summary = "예매 코드로 조회")
    @GetMapping("/api/bookings/code/{code}")
    public ResponseEntity<BookingResponse> getBookingByCode(@PathVariable String code) {
        return ResponseEntity.ok(BookingResponse.from(getBookingUseCase.getBookingByCode(code)));
    }

    @Operation(summary = "예매 취소", description = "상영 시작까지 남은 시간에 따라 환불 금액이 정해집니다. 취소 마감 이후에는 422를 반환합니다.")
    @PostMapping("/api/bookings/{bookingId}/cancel")
    public ResponseEntity<?> cancel(
            @PathVariable long bookingId,
            @Parameter(description = "요청자 ID") @RequestHeader("X-Actor-Id") String actor) {
        CancellationResult result = cancelBookingUseCase.cancel(bookingId, actor);
        return switch (result.outcome()) {
            case CANCELLED -> ResponseEntity.ok(CancellationResponse.from(result));
            case TOO_LATE_TO_CANCEL -> error(ErrorCode.TOO_LATE_TO_CANCEL);
            case NOT_CANCELLABLE -> error(ErrorCode.BOOKING_NOT_CANCELLABLE);
        };
    }

    private ResponseEntity<BookingFailureResponse> failure(ErrorCode errorCode, BookingResult result) {
        return ResponseEntity.status(errorCode.getStatus())
                .body(BookingFailureResponse.of(errorCode, result.booking(), result.failureReason()));
    }

    private ResponseEntity<ErrorResponse> error(ErrorCode errorCode) {
        return ResponseEntity.status(errorCode.getStatus()).body(ErrorResponse.from(errorCode));
    }
}
