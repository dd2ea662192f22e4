package kr.jemi.boxoffice.booking.infrastructure.out.persistence;

import kr.jemi.boxoffice.booking.application.port.out.BookingPort;
import kr.jemi.boxoffice.booking.domain.Booking;
import kr.jemi.boxoffice.booking.domain.BookingStatus;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

@Component
public class BookingJpaAdapter implements BookingPort {

    private final BookingJpaRepository repository;

    public BookingJpaAdapter(BookingJpaRepository repository) {
        this.repository = repository;
    }

    @Override
    @Transactional
    public Booking insert(Booking booking) {
        return repository.saveAndFlush(BookingJpaEntity.fromDomain(booking)).toDomain();
    }

    @Override
    @Transactional
    public Booking update(Booking booking) {
        BookingJpaEntity entity = repository.findById(booking.getId())
                .orElseThrow(() -> new IllegalStateException(
                        "예매를 찾을 수 없습니다: id=" + booking.getId()));
        if (!Objects.equals(entity.getVersion(), booking.getVersion())) {
            throw new OptimisticLockingFailureException(
                    "예매가 이미 변경되었습니다: id=" + booking.getId()
                            + ", expected=" + booking.getVersion() + ", actual=" + entity.getVersion());
        }
        entity.update(booking);
        return repository.saveAndFlush(entity).toDomain();
    }

    @Override
    public Optional<Booking> findById(long bookingId) {
        return repository.findById(bookingId).map(BookingJpaEntity::toDomain);
    }

    @Override
    public Optional<Booking> findByCode(String code) {
        return repository.findByCode(code).map(BookingJpaEntity::toDomain);
    }

    @Override
    public Optional<Booking> findByHoldToken(String holdToken) {
        return repository.findByHoldToken(holdToken).map(BookingJpaEntity::toDomain);
    }

    @Override
    public List<Booking> findPendingCreatedBefore(Instant threshold, int limit) {
        return repository.findByStatusAndCreatedAtBeforeOrderByCreatedAtAsc(
                        BookingStatus.PENDING, threshold, PageRequest.of(0, limit)).stream()
                .map(BookingJpaEntity::toDomain)
                .toList();
    }
}
