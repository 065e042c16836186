package personal.expert.core.payment.application.port.out;

import personal.expert.core.payment.domain.exception.InvalidWebhookSignatureException;
import personal.expert.core.payment.domain.model.PaymentEvent;

/**
 * Payment Event Verifier Port
 * Webhook 서명을 검증하고 결제사 이벤트를 도메인 이벤트로 변환한다.
 */
public interface PaymentEventVerifier {

    PaymentEvent verify(String payload, String signatureHeader) throws InvalidWebhookSignatureException;
}
