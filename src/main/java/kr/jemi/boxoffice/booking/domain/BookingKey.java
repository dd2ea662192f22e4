package kr.jemi.boxoffice.booking.domain;

/**
 * 예매 ID와 사람이 읽을 수 있는 예매 코드. 둘 다 저장소에서 유일하다.
 */
public record BookingKey(long id, String code) {
}
