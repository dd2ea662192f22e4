package kr.jemi.boxoffice.booking.domain;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import kr.jemi.boxoffice.common.event.BookingCancelledEvent;
import kr.jemi.boxoffice.common.event.SeatsBookedEvent;
import kr.jemi.boxoffice.common.validation.SelfValidating;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * 허용되는 상태 전이: PENDING → CONFIRMED, PENDING → CANCELLED(결제 실패),
 * PENDING → EXPIRED(결제 중 선점 만료, 방치된 대기 예매), CONFIRMED → CANCELLED(사용자 취소).
 */
public class Booking implements SelfValidating {

    private static final String HOLD_EXPIRED_REASON = "HOLD_EXPIRED";

    private final long id;
    @NotBlank
    private final String code;
    private final long showId;
    @NotBlank
    private final String holdToken;
    @NotBlank
    private final String actor;
    @NotEmpty
    private final List<@Valid BookedSeat> seats;
    @NotNull
    @Valid
    private final BookingPrice price;
    @NotNull
    private BookingStatus status;
    private String paymentTransactionId;
    private String failureReason;
    private BigDecimal refundAmount;
    private String refundTransactionId;
    @NotNull
    private final Instant createdAt;
    @NotNull
    private Instant updatedAt;
    private final Long version;

    private final List<Object> events = new ArrayList<>();

    public Booking(long id, String code, long showId, String holdToken, String actor,
                   List<BookedSeat> seats, BookingPrice price, BookingStatus status,
                   String paymentTransactionId, String failureReason,
                   BigDecimal refundAmount, String refundTransactionId,
                   Instant createdAt, Instant updatedAt, Long version) {
        this.id = id;
        this.code = code;
        this.showId = showId;
        this.holdToken = holdToken;
        this.actor = actor;
        this.seats = seats == null ? null : List.copyOf(seats);
        this.price = price;
        this.status = status;
        this.paymentTransactionId = paymentTransactionId;
        this.failureReason = failureReason;
        this.refundAmount = refundAmount;
        this.refundTransactionId = refundTransactionId;
        this.createdAt = createdAt;
        this.updatedAt = updatedAt;
        this.version = version;
        validateSelf();
    }

    public static Booking pending(BookingKey key, long showId, String holdToken, String actor,
                                  List<BookedSeat> seats, BookingPrice price, Instant now) {
        return new Booking(key.id(), key.code(), showId, holdToken, actor, seats, price,
                BookingStatus.PENDING, null, null, null, null, now, now, null);
    }

    private void registerEvent(Object event) {
        events.add(event);
    }

    public List<Object> pullEvents() {
        List<Object> result = List.copyOf(events);
        events.clear();
        return result;
    }

    /**
     * 결제 성공 후 좌석 확정까지 끝난 예매. 무료 예매는 결제 거래가 없다.
     */
    public void confirm(String paymentTransactionId, Instant now) {
        requireStatus(BookingStatus.PENDING, "확정");
        this.status = BookingStatus.CONFIRMED;
        this.paymentTransactionId = paymentTransactionId;
        this.updatedAt = now;
        registerEvent(new SeatsBookedEvent(showId, seatIds(), id, code, now));
    }

    public void failPayment(String reason, Instant now) {
        requireStatus(BookingStatus.PENDING, "결제 실패 처리");
        this.status = BookingStatus.CANCELLED;
        this.failureReason = reason;
        this.updatedAt = now;
    }

    public void expire(String reason, Instant now) {
        requireStatus(BookingStatus.PENDING, "만료");
        this.status = BookingStatus.EXPIRED;
        this.failureReason = reason;
        this.updatedAt = now;
    }

    /**
     * 결제는 성공했지만 좌석 확정 시점에 선점이 이미 만료된 경우. 결제 금액 전액을 환불 요청한다.
     */
    public void expireAfterCharge(String paymentTransactionId, Instant now) {
        requireStatus(BookingStatus.PENDING, "만료");
        this.status = BookingStatus.EXPIRED;
        this.paymentTransactionId = paymentTransactionId;
        this.failureReason = HOLD_EXPIRED_REASON;
        this.updatedAt = now;
        requestRefund(price.finalAmount());
    }

    public void cancel(BigDecimal refundAmount, Instant now) {
        requireStatus(BookingStatus.CONFIRMED, "취소");
        if (refundAmount.signum() < 0 || refundAmount.compareTo(price.finalAmount()) > 0) {
            throw new IllegalArgumentException("환불 금액이 결제 금액 범위를 벗어났습니다: " + refundAmount);
        }
        this.status = BookingStatus.CANCELLED;
        this.updatedAt = now;
        requestRefund(refundAmount);
        registerEvent(new BookingCancelledEvent(showId, seatIds(), id, code, refundAmount, now));
    }

    public void markRefunded(String refundTransactionId, Instant now) {
        if (this.refundTransactionId != null) {
            return;
        }
        if (refundAmount == null) {
            throw new IllegalStateException("환불 요청이 없는 예매입니다: " + code);
        }
        this.refundTransactionId = refundTransactionId;
        this.updatedAt = now;
    }

    private void requestRefund(BigDecimal amount) {
        this.refundAmount = amount;
        if (paymentTransactionId != null && amount.signum() > 0) {
            registerEvent(new RefundRequestedEvent(id, code, amount));
        }
    }

    private void requireStatus(BookingStatus expected, String action) {
        if (this.status != expected) {
            throw new IllegalStateException(
                    expected + " 상태에서만 " + action + "할 수 있습니다. 현재: " + this.status);
        }
    }

    public boolean isOwnedBy(String actor) {
        return this.actor.equals(actor);
    }

    public boolean isRefundSettled() {
        return refundTransactionId != null;
    }

    public List<String> seatIds() {
        return seats.stream().map(BookedSeat::seatId).toList();
    }

    public long getId() {
        return id;
    }

    public String getCode() {
        return code;
    }

    public long getShowId() {
        return showId;
    }

    public String getHoldToken() {
        return holdToken;
    }

    public String getActor() {
        return actor;
    }

    public List<BookedSeat> getSeats() {
        return seats;
    }

    public BookingPrice getPrice() {
        return price;
    }

    public BookingStatus getStatus() {
        return status;
    }

    public String getPaymentTransactionId() {
        return paymentTransactionId;
    }

    public String getFailureReason() {
        return failureReason;
    }

    public BigDecimal getRefundAmount() {
        return refundAmount;
    }

    public String getRefundTransactionId() {
        return refundTransactionId;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public Long getVersion() {
        return version;
    }
}
