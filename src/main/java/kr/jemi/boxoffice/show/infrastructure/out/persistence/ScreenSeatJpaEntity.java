package kr.jemi.boxoffice.show.infrastructure.out.persistence;

import jakarta.persistence.*;
import kr.jemi.boxoffice.show.domain.ScreenSeat;

import java.math.BigDecimal;

@Entity
@Table(name = "screen_seats",
        uniqueConstraints = @UniqueConstraint(name = "uk_screen_seat", columnNames = {"screenId", "seatId"}))
public class ScreenSeatJpaEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private long screenId;

    @Column(nullable = false, length = 16)
    private String seatId;

    @Column(nullable = false, length = 32)
    private String tier;

    @Column(nullable = false, precision = 12, scale = 2)
    private BigDecimal priceDelta;

    protected ScreenSeatJpaEntity() {}

    public static ScreenSeatJpaEntity fromDomain(ScreenSeat seat) {
        ScreenSeatJpaEntity entity = new ScreenSeatJpaEntity();
        entity.screenId = seat.screenId();
        entity.seatId = seat.seatId();
        entity.tier = seat.tier();
        entity.priceDelta = seat.priceDelta();
        return entity;
    }

    public ScreenSeat toDomain() {
        return new ScreenSeat(seatId, screenId, tier, priceDelta);
    }
}
