package kr.jemi.boxoffice.seat.domain;

import jakarta.validation.constraints.NotNull;
import kr.jemi.boxoffice.common.validation.SelfValidating;

import java.time.Instant;

/**
 * 상영별 좌석 한 칸의 상태.
 * HELD의 owner는 선점 토큰, BOOKED의 owner는 예매 코드다.
 */
public record SeatState(@NotNull SeatStatus status, String owner, Instant heldUntil) implements SelfValidating {

    private static final SeatState AVAILABLE = new SeatState(SeatStatus.AVAILABLE, null, null);

    public SeatState(SeatStatus status, String owner, Instant heldUntil) {
        this.status = status;
        this.owner = owner;
        this.heldUntil = heldUntil;
        validate();
    }

    public static SeatState available() {
        return AVAILABLE;
    }

    public static SeatState held(String holdToken, Instant heldUntil) {
        return new SeatState(SeatStatus.HELD, holdToken, heldUntil);
    }

    public static SeatState booked(String bookingCode) {
        return new SeatState(SeatStatus.BOOKED, bookingCode, null);
    }

    private void validate() {
        validateSelf();
        switch (status) {
            case AVAILABLE -> {
                if (owner != null || heldUntil != null) {
                    throw new IllegalArgumentException("AVAILABLE 좌석은 소유자가 없어야 합니다");
                }
            }
            case HELD -> {
                requireOwner();
                if (heldUntil == null) {
                    throw new IllegalArgumentException("HELD 좌석은 만료 시각이 반드시 있어야 합니다");
                }
            }
            case BOOKED -> {
                requireOwner();
                if (heldUntil != null) {
                    throw new IllegalArgumentException("BOOKED 좌석은 만료 시각이 없어야 합니다");
                }
            }
        }
    }

    private void requireOwner() {
        if (owner == null || owner.isBlank()) {
            throw new IllegalArgumentException(status + " 좌석은 소유자가 반드시 있어야 합니다");
        }
    }

    public boolean isAvailable() {
        return status == SeatStatus.AVAILABLE;
    }

    public boolean isHeldBy(String holdToken) {
        return status == SeatStatus.HELD && owner.equals(holdToken);
    }

    public boolean isBookedBy(String bookingCode) {
        return status == SeatStatus.BOOKED && owner.equals(bookingCode);
    }

    /**
     * 선점 만료 여부. 만료 시각과 같은 순간부터 만료로 본다.
     */
    public boolean isExpiredAt(Instant now) {
        return status == SeatStatus.HELD && !heldUntil.isAfter(now);
    }
}
