package kr.jemi.boxoffice.booking.infrastructure.out.persistence;

import kr.jemi.boxoffice.booking.domain.BookingStatus;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface BookingJpaRepository extends JpaRepository<BookingJpaEntity, Long> {
    Optional<BookingJpaEntity> findByCode(String code);

    Optional<BookingJpaEntity> findByHoldToken(String holdToken);

    List<BookingJpaEntity> findByStatusAndCreatedAtBeforeOrderByCreatedAtAsc(
            BookingStatus status, Instant createdAt, Pageable pageable);
}
