package kr.jemi.boxoffice.booking.domain;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;
import java.util.Map;

/**
 * 좌석 가격 합계 + 좌석당 수수료 - 프로모션 할인(좌석 가격 합계 기준 비율).
 * 최종 금액은 0 미만이 되지 않는다.
 */
public class BookingPricing {

    private final BigDecimal feePerSeat;
    private final Map<String, Integer> promoPercents;

    public BookingPricing(BigDecimal feePerSeat, Map<String, Integer> promoPercents) {
        if (feePerSeat == null || feePerSeat.signum() < 0) {
            throw new IllegalArgumentException("좌석당 수수료는 0 이상이어야 합니다: " + feePerSeat);
        }
        promoPercents.forEach((code, percent) -> {
            if (percent < 0 || percent > 100) {
                throw new IllegalArgumentException("할인율은 0~100 사이여야 합니다: " + code + "=" + percent);
            }
        });
        this.feePerSeat = feePerSeat;
        this.promoPercents = Map.copyOf(promoPercents);
    }

    public boolean isKnownPromo(String promoCode) {
        return promoCode == null || promoPercents.containsKey(promoCode);
    }

    public BookingPrice price(List<BookedSeat> seats, String promoCode) {
        if (!isKnownPromo(promoCode)) {
            throw new IllegalArgumentException("알 수 없는 프로모션 코드: " + promoCode);
        }
        BigDecimal subtotal = seats.stream()
                .map(BookedSeat::price)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
        BigDecimal fee = feePerSeat.multiply(BigDecimal.valueOf(seats.size()));
        BigDecimal discount = promoCode == null
                ? BigDecimal.ZERO
                : subtotal.multiply(BigDecimal.valueOf(promoPercents.get(promoCode)))
                        .divide(BigDecimal.valueOf(100), 2, RoundingMode.DOWN);
        BigDecimal finalAmount = subtotal.add(fee).subtract(discount).max(BigDecimal.ZERO);
        return new BookingPrice(subtotal, fee, discount, finalAmount, promoCode);
    }
}
