package kr.jemi.boxoffice.booking.domain;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.util.Comparator;
import java.util.List;

/**
 * 취소 마감 + 구간별 환불 정책. 환불액은 (결제 금액, 상영까지 남은 시간, 구간)만으로 결정되며
 * 남은 시간이 줄어들수록 환불액은 늘어나지 않는다.
 */
public class RefundPolicy {

    private final Duration cancellationCutoff;
    private final List<RefundTier> tiers;

    public RefundPolicy(Duration cancellationCutoff, List<RefundTier> tiers) {
        if (cancellationCutoff == null || cancellationCutoff.isNegative()) {
            throw new IllegalArgumentException("취소 마감 시간은 0 이상이어야 합니다");
        }
        this.cancellationCutoff = cancellationCutoff;
        this.tiers = tiers.stream()
                .sorted(Comparator.comparing(RefundTier::minTimeBeforeShow).reversed())
                .toList();
        for (int i = 1; i < this.tiers.size(); i++) {
            if (this.tiers.get(i).percent() > this.tiers.get(i - 1).percent()) {
                throw new IllegalArgumentException("상영이 가까운 구간의 환불 비율이 더 클 수 없습니다: " + this.tiers);
            }
        }
    }

    /**
     * 상영까지 남은 시간이 취소 마감보다 길어야 취소할 수 있다.
     */
    public boolean isCancellable(Duration timeToShow) {
        return timeToShow.compareTo(cancellationCutoff) > 0;
    }

    public BigDecimal refundFor(BigDecimal paidAmount, Duration timeToShow) {
        if (!isCancellable(timeToShow)) {
            return BigDecimal.ZERO;
        }
        return tiers.stream()
                .filter(tier -> timeToShow.compareTo(tier.minTimeBeforeShow()) >= 0)
                .findFirst()
                .map(tier -> paidAmount.multiply(BigDecimal.valueOf(tier.percent()))
                        .divide(BigDecimal.valueOf(100), 2, RoundingMode.DOWN))
                .orElse(BigDecimal.ZERO);
    }

    public Duration getCancellationCutoff() {
        return cancellationCutoff;
    }
}
