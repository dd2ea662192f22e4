package kr.jemi.boxoffice.show.api;

import java.math.BigDecimal;

/**
 * price = 상영 기본가 + 좌석 등급 가격 차이.
 */
public record ShowSeatInfo(String seatId, String tier, BigDecimal price) {
}
