package kr.jemi.boxoffice.show.infrastructure.out.persistence;

import jakarta.persistence.*;
import kr.jemi.boxoffice.show.domain.Show;

import java.math.BigDecimal;
import java.time.Instant;

@Entity
@Table(name = "shows")
public class ShowJpaEntity {

    @Id
    private Long id;

    @Column(nullable = false)
    private String title;

    @Column(nullable = false)
    private long screenId;

    @Column(nullable = false)
    private Instant scheduledAt;

    @Column(nullable = false, precision = 12, scale = 2)
    private BigDecimal basePrice;

    @Column(nullable = false)
    private int totalSeats;

    protected ShowJpaEntity() {}

    public static ShowJpaEntity fromDomain(Show show) {
        ShowJpaEntity entity = new ShowJpaEntity();
        entity.id = show.id();
        entity.title = show.title();
        entity.screenId = show.screenId();
        entity.scheduledAt = show.scheduledAt();
        entity.basePrice = show.basePrice();
        entity.totalSeats = show.totalSeats();
        return entity;
    }

    public Show toDomain() {
        return new Show(id, title, screenId, scheduledAt, basePrice, totalSeats);
    }
}
