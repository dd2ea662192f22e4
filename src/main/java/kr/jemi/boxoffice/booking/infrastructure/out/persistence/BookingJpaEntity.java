package kr.jemi.boxoffice.booking.infrastructure.out.persistence;

import jakarta.persistence.*;
import kr.jemi.boxoffice.booking.domain.Booking;
import kr.jemi.boxoffice.booking.domain.BookingPrice;
import kr.jemi.boxoffice.booking.domain.BookingStatus;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

@Entity
@Table(name = "bookings",
        indexes = @Index(name = "idx_booking_status_created_at", columnList = "status, createdAt"))
public class BookingJpaEntity {

    @Id
    private Long id;

    @Column(nullable = false, unique = true, length = 32)
    private String code;

    @Column(nullable = false)
    private long showId;

    @Column(nullable = false, unique = true, length = 64)
    private String holdToken;

    @Column(nullable = false)
    private String actor;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "booking_seats", joinColumns = @JoinColumn(name = "booking_id"))
    @OrderColumn(name = "seat_order")
    private List<BookedSeatEmbeddable> seats = new ArrayList<>();

    @Column(nullable = false, precision = 12, scale = 2)
    private BigDecimal subtotal;

    @Column(nullable = false, precision = 12, scale = 2)
    private BigDecimal fee;

    @Column(nullable = false, precision = 12, scale = 2)
    private BigDecimal discount;

    @Column(nullable = false, precision = 12, scale = 2)
    private BigDecimal finalAmount;

    private String promoCode;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private BookingStatus status;

    private String paymentTransactionId;

    private String failureReason;

    @Column(precision = 12, scale = 2)
    private BigDecimal refundAmount;

    private String refundTransactionId;

    @Column(nullable = false)
    private Instant createdAt;

    @Column(nullable = false)
    private Instant updatedAt;

    @Version
    private Long version;

    protected BookingJpaEntity() {}

    public static BookingJpaEntity fromDomain(Booking booking) {
        BookingJpaEntity entity = new BookingJpaEntity();
        entity.id = booking.getId();
        entity.code = booking.getCode();
        entity.showId = booking.getShowId();
        entity.holdToken = booking.getHoldToken();
        entity.actor = booking.getActor();
        entity.seats = new ArrayList<>(booking.getSeats().stream()
                .map(BookedSeatEmbeddable::fromDomain)
                .toList());
        BookingPrice price = booking.getPrice();
        entity.subtotal = price.subtotal();
        entity.fee = price.fee();
        entity.discount = price.discount();
        entity.finalAmount = price.finalAmount();
        entity.promoCode = price.promoCode();
        entity.update(booking);
        return entity;
    }

    public Booking toDomain() {
        return new Booking(id, code, showId, holdToken, actor,
                seats.stream().map(BookedSeatEmbeddable::toDomain).toList(),
                new BookingPrice(subtotal, fee, discount, finalAmount, promoCode),
                status, paymentTransactionId, failureReason, refundAmount, refundTransactionId,
                createdAt, updatedAt, version);
    }

    /**
     * 상태 전이로 바뀌는 필드만 반영한다. 좌석과 금액은 생성 후 바뀌지 않는다.
     */
    public void update(Booking booking) {
        this.status = booking.getStatus();
        this.paymentTransactionId = booking.getPaymentTransactionId();
        this.failureReason = booking.getFailureReason();
        this.refundAmount = booking.getRefundAmount();
        this.refundTransactionId = booking.getRefundTransactionId();
        this.createdAt = booking.getCreatedAt();
        this.updatedAt = booking.getUpdatedAt();
    }

    public Long getVersion() { return version; }
}
