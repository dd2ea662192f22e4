package kr.jemi.boxoffice.booking.infrastructure.out.payment;

import kr.jemi.boxoffice.booking.application.port.out.PaymentPort;
import kr.jemi.boxoffice.booking.domain.PaymentResult;
import kr.jemi.boxoffice.booking.infrastructure.out.payment.dto.ChargeRequest;
import kr.jemi.boxoffice.booking.infrastructure.out.payment.dto.PaymentGatewayResponse;
import kr.jemi.boxoffice.booking.infrastructure.out.payment.dto.RefundRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

import java.math.BigDecimal;

/**
 * 결제 대행사 REST 연동. 같은 Idempotency-Key로 다시 요청하면 대행사는 최초 결과를 돌려준다.
 * 연결/응답 시간 초과와 해석할 수 없는 응답은 TIMEOUT, 거절 및 오류 응답은 FAILURE로 변환한다.
 */
@Component
public class PaymentGatewayAdapter implements PaymentPort {

    private static final Logger log = LoggerFactory.getLogger(PaymentGatewayAdapter.class);

    static final String IDEMPOTENCY_KEY_HEADER = "Idempotency-Key";

    private final RestClient paymentRestClient;

    public PaymentGatewayAdapter(@Qualifier("paymentRestClient") RestClient paymentRestClient) {
        this.paymentRestClient = paymentRestClient;
    }

    @Override
    public PaymentResult charge(BigDecimal amount, String paymentMethod, String idempotencyKey) {
        return call("/v1/charges", new ChargeRequest(amount, paymentMethod), idempotencyKey);
    }

    @Override
    public PaymentResult refund(String paymentTransactionId, BigDecimal amount, String idempotencyKey) {
        return call("/v1/refunds", new RefundRequest(paymentTransactionId, amount), idempotencyKey);
    }

    private PaymentResult call(String uri, Object body, String idempotencyKey) {
        try {
            PaymentGatewayResponse response = paymentRestClient.post()
                    .uri(uri)
                    .contentType(MediaType.APPLICATION_JSON)
                    .header(IDEMPOTENCY_KEY_HEADER, idempotencyKey)
                    .body(body)
                    .retrieve()
                    .body(PaymentGatewayResponse.class);
            if (response == null) {
                return PaymentResult.failure("EMPTY_RESPONSE");
            }
            if (!response.isApproved()) {
                return PaymentResult.failure(response.reason() != null ? response.reason() : response.status());
            }
            if (!response.hasTransactionId()) {
                // 승인되었지만 거래 ID가 없으면 결제 여부를 확정할 수 없다
                log.warn("결제 대행사 승인 응답에 거래 ID 없음: uri={}, key={}", uri, idempotencyKey);
                return PaymentResult.timeout();
            }
            return PaymentResult.success(response.transactionId());
        } catch (ResourceAccessException e) {
            log.warn("결제 대행사 응답 시간 초과: uri={}, key={}", uri, idempotencyKey, e);
            return PaymentResult.timeout();
        } catch (RestClientResponseException e) {
            log.warn("결제 대행사 오류 응답: uri={}, key={}, status={}", uri, idempotencyKey, e.getStatusCode());
            return PaymentResult.failure("GATEWAY_" + e.getStatusCode().value());
        } catch (RestClientException e) {
            // 응답을 해석할 수 없으면 승인 여부를 알 수 없으므로 시간 초과와 같이 다룬다
            log.warn("결제 대행사 응답 해석 실패: uri={}, key={}", uri, idempotencyKey, e);
            return PaymentResult.timeout();
        }
    }
}
