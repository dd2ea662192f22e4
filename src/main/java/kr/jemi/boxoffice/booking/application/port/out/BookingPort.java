package kr.jemi.boxoffice.booking.application.port.out;

import kr.jemi.boxoffice.booking.domain.Booking;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface BookingPort {

    /**
     * 예매 코드와 선점 토큰은 유일해야 하며 중복이면 DataIntegrityViolationException이 발생한다.
     */
    Booking insert(Booking booking);

    /**
     * 버전이 맞지 않으면 OptimisticLockingFailureException이 발생한다.
     */
    Booking update(Booking booking);

    Optional<Booking> findById(long bookingId);

    Optional<Booking> findByCode(String code);

    Optional<Booking> findByHoldToken(String holdToken);

    List<Booking> findPendingCreatedBefore(Instant threshold, int limit);
}
