package kr.jemi.boxoffice.show.domain;

/**
 * 잔여 좌석 수는 저장하지 않고 전체 좌석 수와 예매 좌석 카운터로부터 계산한다.
 */
public record Availability(long showId, int totalSeats, long booked) {

    public Availability {
        if (booked < 0) {
            throw new IllegalArgumentException("예매 좌석 수는 음수일 수 없습니다: " + booked);
        }
    }

    public long available() {
        return Math.max(0, totalSeats - booked);
    }
}
