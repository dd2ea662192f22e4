package kr.jemi.boxoffice.booking.infrastructure.in.web.dto;

import kr.jemi.boxoffice.booking.domain.Booking;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

public record BookingResponse(
        long bookingId,
        String code,
        long showId,
        List<SeatLine> seats,
        BigDecimal subtotal,
        BigDecimal fee,
        BigDecimal discount,
        BigDecimal finalAmount,
        String promoCode,
        String status,
        String failureReason,
        BigDecimal refundAmount,
        Instant createdAt,
        Instant updatedAt
) {

    public record SeatLine(String seatId, String tier, BigDecimal price) {
    }

    public static BookingResponse from(Booking booking) {
        return new BookingResponse(
                booking.getId(),
                booking.getCode(),
                booking.getShowId(),
                booking.getSeats().stream()
                        .map(seat -> new SeatLine(seat.seatId(), seat.tier(), seat.price()))
                        .toList(),
                booking.getPrice().subtotal(),
                booking.getPrice().fee(),
                booking.getPrice().discount(),
                booking.getPrice().finalAmount(),
                booking.getPrice().promoCode(),
                booking.getStatus().name(),
                booking.getFailureReason(),
                booking.getRefundAmount(),
                booking.getCreatedAt(),
                booking.getUpdatedAt()
        );
    }
}
