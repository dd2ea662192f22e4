package kr.jemi.boxoffice.booking.application.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.List;
import java.util.Map;

@ConfigurationProperties("boxoffice.booking")
public record BookingProperties(
        BigDecimal feePerSeat,
        Map<String, Integer> promoCodes,
        Duration cancellationCutoff,
        List<Tier> refundTiers,
        Duration staleGrace,
        int staleBatchSize
) {

    public BookingProperties {
        promoCodes = promoCodes == null ? Map.of() : promoCodes;
        refundTiers = refundTiers == null ? List.of() : refundTiers;
    }

    public record Tier(Duration before, int percent) {
    }
}
