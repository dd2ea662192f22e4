package kr.jemi.boxoffice.booking.application.service;

import kr.jemi.boxoffice.booking.application.port.in.SubmitBookingCommand;
import kr.jemi.boxoffice.booking.application.port.in.SubmitBookingUseCase;
import kr.jemi.boxoffice.booking.application.port.out.BookingPort;
import kr.jemi.boxoffice.booking.application.port.out.HeldSeatsPort;
import kr.jemi.boxoffice.booking.application.port.out.PaymentPort;
import kr.jemi.boxoffice.booking.application.port.out.SeatBookingPort;
import kr.jemi.boxoffice.booking.application.port.out.ShowCatalogPort;
import kr.jemi.boxoffice.booking.domain.BookedSeat;
import kr.jemi.boxoffice.booking.domain.Booking;
import kr.jemi.boxoffice.booking.domain.BookingPrice;
import kr.jemi.boxoffice.booking.domain.BookingPricing;
import kr.jemi.boxoffice.booking.domain.BookingResult;
import kr.jemi.boxoffice.booking.domain.FinalizeOutcome;
import kr.jemi.boxoffice.booking.domain.HeldSeats;
import kr.jemi.boxoffice.booking.domain.PaymentResult;
import kr.jemi.boxoffice.common.event.ReleaseReason;
import kr.jemi.boxoffice.common.exception.BusinessException;
import kr.jemi.boxoffice.common.exception.ErrorCode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

@Service
public class BookingService implements SubmitBookingUseCase {

    private static final Logger log = LoggerFactory.getLogger(BookingService.class);

    private static final String CHARGE_KEY_PREFIX = "hold:";

    private final BookingPort bookingPort;
    private final BookingWriter bookingWriter;
    private final HeldSeatsPort heldSeatsPort;
    private final ShowCatalogPort showCatalogPort;
    private final SeatBookingPort seatBookingPort;
    private final PaymentPort paymentPort;
    private final BookingCodeGenerator bookingCodeGenerator;
    private final BookingPricing bookingPricing;
    private final Clock clock;

    public BookingService(BookingPort bookingPort,
                          BookingWriter bookingWriter,
                          HeldSeatsPort heldSeatsPort,
                          ShowCatalogPort showCatalogPort,
                          SeatBookingPort seatBookingPort,
                          PaymentPort paymentPort,
                          BookingCodeGenerator bookingCodeGenerator,
                          BookingPricing bookingPricing,
                          Clock clock) {
        this.bookingPort = bookingPort;
        this.bookingWriter = bookingWriter;
        this.heldSeatsPort = heldSeatsPort;
        this.showCatalogPort = showCatalogPort;
        this.seatBookingPort = seatBookingPort;
        this.paymentPort = paymentPort;
        this.bookingCodeGenerator = bookingCodeGenerator;
        this.bookingPricing = bookingPricing;
        this.clock = clock;
    }

    @Override
    public BookingResult submit(SubmitBookingCommand command) {
        // 0. 같은 선점으로 이미 만든 예매가 있으면 다시 결제하지 않고 그 결과를 돌려준다
        Optional<Booking> existing = bookingPort.findByHoldToken(command.holdToken());
        if (existing.isPresent()) {
            return replay(existing.get(), command.actor());
        }

        // 1. 선점 검증
        Instant now = clock.instant();
        Optional<HeldSeats> found = heldSeatsPort.findHold(command.holdToken());
        if (found.isEmpty() || found.get().isExpiredAt(now)) {
            return BookingResult.holdExpired(null);
        }
        HeldSeats held = found.get();
        if (!held.isOwnedBy(command.actor())) {
            throw new BusinessException(ErrorCode.HOLD_ACCESS_DENIED);
        }

        // 2. 가격 재계산
        if (!bookingPricing.isKnownPromo(command.promoCode())) {
            throw new BusinessException(ErrorCode.INVALID_PROMO_CODE);
        }
        List<BookedSeat> seats = priceSeats(held);
        BookingPrice price = bookingPricing.price(seats, command.promoCode());

        // 3. PENDING 예매 저장 (선점 토큰 유일 제약으로 동시 제출을 막는다)
        Booking booking = Booking.pending(bookingCodeGenerator.next(), held.showId(), held.holdToken(),
                command.actor(), seats, price, now);
        try {
            booking = bookingWriter.insert(booking);
        } catch (DataIntegrityViolationException e) {
            log.info("동시 예매 제출 감지, 기존 예매 결과 반환: holdToken={}", command.holdToken());
            return bookingPort.findByHoldToken(command.holdToken())
                    .map(other -> replay(other, command.actor()))
                    .orElseThrow(() -> e);
        }

        // 4. 결제 (선점당 멱등키 하나). 결제 금액이 0이면 결제 없이 확정한다
        if (price.isFree()) {
            return complete(booking, held, null);
        }
        PaymentResult payment = paymentPort.charge(price.finalAmount(), command.paymentMethod(),
                CHARGE_KEY_PREFIX + held.holdToken());

        // 5~6. 확정 또는 되돌리기
        return switch (payment.outcome()) {
            case SUCCESS -> complete(booking, held, payment.transactionId());
            case FAILURE, TIMEOUT -> unwind(booking, held, payment.failureReason());
        };
    }

    private BookingResult complete(Booking booking, HeldSeats held, String paymentTransactionId) {
        FinalizeOutcome finalized = seatBookingPort.finalizeSeats(held.showId(), held.seatIds(),
                held.holdToken(), booking.getCode(), clock.instant());

        return switch (finalized) {
            case FINALIZED -> {
                booking.confirm(paymentTransactionId, clock.instant());
                try {
                    booking = bookingWriter.update(booking);
                } catch (RuntimeException e) {
                    // 롤백: 좌석 반환. 결제 건은 수동 환불 대상으로 남긴다
                    log.error("[ALERT] 예매 확정 저장 실패, 좌석 반환: code={}, paymentTx={}",
                            booking.getCode(), paymentTransactionId, e);
                    seatBookingPort.freeSeats(held.showId(), held.seatIds(), booking.getCode());
                    throw new BusinessException(ErrorCode.BOOKING_CONFIRM_FAILED);
                }
                heldSeatsPort.consume(held.holdToken());
                log.info("예매 확정: code={}, show={}, seats={}", booking.getCode(), held.showId(), held.seatIds());
                yield BookingResult.confirmed(booking);
            }
            case EXPIRED, NOT_FOUND -> {
                // 결제 도중 선점이 만료되었거나 스윕에 회수됨
                booking.expireAfterCharge(paymentTransactionId, clock.instant());
                booking = bookingWriter.update(booking);
                heldSeatsPort.release(held.holdToken(), ReleaseReason.EXPIRED);
                log.warn("결제 후 선점 만료, 전액 환불 요청: code={}, paymentTx={}",
                        booking.getCode(), paymentTransactionId);
                yield BookingResult.holdExpired(booking);
            }
        };
    }

    private BookingResult unwind(Booking booking, HeldSeats held, String reason) {
        heldSeatsPort.release(held.holdToken(), ReleaseReason.PAYMENT_FAILED);
        booking.failPayment(reason, clock.instant());
        booking = bookingWriter.update(booking);
        log.warn("결제 실패, 선점 해제: code={}, reason={}", booking.getCode(), reason);
        return BookingResult.paymentFailed(booking, reason);
    }

    private BookingResult replay(Booking booking, String actor) {
        if (!booking.isOwnedBy(actor)) {
            throw new BusinessException(ErrorCode.BOOKING_ACCESS_DENIED);
        }
        return switch (booking.getStatus()) {
            case PENDING -> BookingResult.inProgress(booking);
            case CONFIRMED -> BookingResult.confirmed(booking);
            // 결제 실패로 취소된 예매만 사유가 남는다. 사유 없는 취소는 확정 후 사용자 취소다
            case CANCELLED -> booking.getFailureReason() != null
                    ? BookingResult.paymentFailed(booking, booking.getFailureReason())
                    : BookingResult.confirmed(booking);
            case EXPIRED -> BookingResult.holdExpired(booking);
        };
    }

    private List<BookedSeat> priceSeats(HeldSeats held) {
        Map<String, BookedSeat> catalog = showCatalogPort.findSeatPrices(held.showId()).stream()
                .collect(Collectors.toMap(BookedSeat::seatId, Function.identity()));
        return held.seatIds().stream()
                .map(seatId -> Optional.ofNullable(catalog.get(seatId))
                        .orElseThrow(() -> new BusinessException(ErrorCode.INVALID_SEATS)))
                .toList();
    }
}
