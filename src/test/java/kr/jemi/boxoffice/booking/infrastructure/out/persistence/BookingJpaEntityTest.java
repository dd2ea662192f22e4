package kr.jemi.boxoffice.booking.infrastructure.out.persistence;

import kr.jemi.boxoffice.booking.domain.Booking;
import kr.jemi.boxoffice.booking.domain.BookingFixtures;
import kr.jemi.boxoffice.booking.domain.BookingStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.assertThat;

class BookingJpaEntityTest {

    @Test
    @DisplayName("엔티티 변환 후 되돌려도 좌석, 금액, 상태가 유지된다")
    void roundTrip() {
        // given
        Booking booking = BookingFixtures.confirmed("user-1");
        booking.cancel(new BigDecimal("70000"), BookingFixtures.NOW);

        // when
        Booking restored = BookingJpaEntity.fromDomain(booking).toDomain();

        // then
        assertThat(restored.getCode()).isEqualTo("BK0001");
        assertThat(restored.getStatus()).isEqualTo(BookingStatus.CANCELLED);
        assertThat(restored.seatIds()).containsExactly("A1", "A2");
        assertThat(restored.getPrice()).isEqualTo(booking.getPrice());
        assertThat(restored.getPaymentTransactionId()).isEqualTo("pay-1");
        assertThat(restored.getRefundAmount()).isEqualByComparingTo("70000");
        assertThat(restored.getVersion()).isNull();
    }

    @Test
    @DisplayName("update는 상태 전이 필드만 반영한다")
    void updateTransitionFields() {
        // given
        Booking pending = BookingFixtures.pending("user-1");
        BookingJpaEntity entity = BookingJpaEntity.fromDomain(pending);
        pending.failPayment("CARD_DECLINED", BookingFixtures.NOW);

        // when
        entity.update(pending);

        // then
        Booking restored = entity.toDomain();
        assertThat(restored.getStatus()).isEqualTo(BookingStatus.CANCELLED);
        assertThat(restored.getFailureReason()).isEqualTo("CARD_DECLINED");
    }
}
