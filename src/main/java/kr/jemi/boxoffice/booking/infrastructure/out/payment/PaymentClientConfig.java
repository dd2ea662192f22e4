package kr.jemi.boxoffice.booking.infrastructure.out.payment;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

import java.net.http.HttpClient;
import java.time.Duration;

/**
 * 결제 호출은 예매 흐름에서 유일하게 블로킹되는 구간이다. 응답 대기는 read-timeout으로 제한하고
 * 시간 초과는 결제 실패로 취급한다.
 */
@Configuration
public class PaymentClientConfig {

    private static final Duration MAX_READ_TIMEOUT = Duration.ofSeconds(30);

    @Value("${boxoffice.payment.base-url}")
    private String baseUrl;

    @Value("${boxoffice.payment.connect-timeout}")
    private Duration connectTimeout;

    @Value("${boxoffice.payment.read-timeout}")
    private Duration readTimeout;

    @Bean
    public RestClient paymentRestClient() {
        if (readTimeout.compareTo(MAX_READ_TIMEOUT) > 0) {
            throw new IllegalStateException("결제 응답 타임아웃은 30초를 넘을 수 없습니다: " + readTimeout);
        }
        HttpClient httpClient = HttpClient.newBuilder()
                .connectTimeout(connectTimeout)
                .build();

        JdkClientHttpRequestFactory requestFactory = new JdkClientHttpRequestFactory(httpClient);
        requestFactory.setReadTimeout(readTimeout);

        return RestClient.builder()
                .baseUrl(baseUrl)
                .requestFactory(requestFactory)
                .build();
    }
}
