package kr.jemi.boxoffice.booking.application.config;

import kr.jemi.boxoffice.booking.domain.BookingPricing;
import kr.jemi.boxoffice.booking.domain.RefundPolicy;
import kr.jemi.boxoffice.booking.domain.RefundTier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class BookingPolicyConfig {

    @Bean
    public BookingPricing bookingPricing(BookingProperties properties) {
        return new BookingPricing(properties.feePerSeat(), properties.promoCodes());
    }

    @Bean
    public RefundPolicy refundPolicy(BookingProperties properties) {
        return new RefundPolicy(properties.cancellationCutoff(), properties.refundTiers().stream()
                .map(tier -> new RefundTier(tier.before(), tier.percent()))
                .toList());
    }
}
