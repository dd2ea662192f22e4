package kr.jemi.boxoffice.booking.infrastructure.out.persistence;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import kr.jemi.boxoffice.booking.domain.BookedSeat;

import java.math.BigDecimal;

@Embeddable
public class BookedSeatEmbeddable {

    @Column(nullable = false, length = 16)
    private String seatId;

    @Column(nullable = false, length = 32)
    private String tier;

    @Column(nullable = false, precision = 12, scale = 2)
    private BigDecimal price;

    protected BookedSeatEmbeddable() {}

    public static BookedSeatEmbeddable fromDomain(BookedSeat seat) {
        BookedSeatEmbeddable embeddable = new BookedSeatEmbeddable();
        embeddable.seatId = seat.seatId();
        embeddable.tier = seat.tier();
        embeddable.price = seat.price();
        return embeddable;
    }

    public BookedSeat toDomain() {
        return new BookedSeat(seatId, tier, price);
    }
}
