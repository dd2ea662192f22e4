package kr.jemi.boxoffice.booking.domain;

import java.time.Duration;

/**
 * 상영까지 남은 시간이 minTimeBeforeShow 이상이면 결제 금액의 percent%를 환불한다.
 */
public record RefundTier(Duration minTimeBeforeShow, int percent) {

    public RefundTier {
        if (minTimeBeforeShow == null || minTimeBeforeShow.isNegative()) {
            throw new IllegalArgumentException("환불 구간 기준 시간은 0 이상이어야 합니다");
        }
        if (percent < 0 || percent > 100) {
            throw new IllegalArgumentException("환불 비율은 0~100 사이여야 합니다: " + percent);
        }
    }
}
