package personal.expert.core.payment.adapter.out.stripe;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.stripe.exception.SignatureVerificationException;
import com.stripe.net.Webhook;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import personal.expert.core.payment.application.config.PaymentProperties;
import personal.expert.core.payment.application.port.out.PaymentEventVerifier;
import personal.expert.core.payment.domain.exception.InvalidWebhookSignatureException;
import personal.expert.core.payment.domain.model.PaymentEvent;
import personal.expert.core.payment.domain.model.PaymentEventType;

/**
 * Stripe Webhook Verifier
 * Stripe-Signature 헤더(t=..., v1=...)를 검증한 뒤 이벤트 본문을 도메인 이벤트로 변환한다.
 * <p>
 * payment_intent 이벤트는 object.id, charge 이벤트는 object.payment_intent를 홀드 식별자로 사용한다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StripePaymentEventVerifier implements PaymentEventVerifier {

    private final PaymentProperties paymentProperties;
    private final ObjectMapper objectMapper;

    @Override
    public PaymentEvent verify(String payload, String signatureHeader) {
        if (!StringUtils.hasText(signatureHeader)) {
            throw new InvalidWebhookSignatureException("missing signature header");
        }
        PaymentProperties.Stripe stripe = paymentProperties.stripe();
        if (!StringUtils.hasText(stripe.webhookSecret())) {
            log.error("Stripe webhook secret is not configured");
            throw new InvalidWebhookSignatureException("webhook secret not configured");
        }

        try {
            Webhook.Signature.verifyHeader(payload, signatureHeader, stripe.webhookSecret(),
                    stripe.webhookToleranceSeconds());
        } catch (SignatureVerificationException e) {
            throw new InvalidWebhookSignatureException(e.getMessage(), e);
        }

        return parse(payload);
    }

    private PaymentEvent parse(String payload) {
        JsonNode root;
        try {
            root = objectMapper.readTree(payload);
        } catch (JsonProcessingException e) {
            throw new InvalidWebhookSignatureException("payload is not valid JSON", e);
        }

        String eventId = root.path("id").asText(null);
        String rawType = root.path("type").asText(null);
        if (eventId == null || rawType == null) {
            throw new InvalidWebhookSignatureException("payload is missing id or type");
        }

        JsonNode object = root.path("data").path("object");
        PaymentEventType type = mapType(rawType);
        boolean isCharge = rawType.startsWith("charge.");

        String holdReference = isCharge
                ? object.path("payment_intent").asText(null)
                : object.path("id").asText(null);

        return new PaymentEvent(eventId, type, rawType, bookingIdOf(object), holdReference,
                amountOf(type, object));
    }

    private PaymentEventType mapType(String rawType) {
        return switch (rawType) {
            case "payment_intent.amount_capturable_updated" -> PaymentEventType.HOLD_SUCCEEDED;
            case "payment_intent.payment_failed" -> PaymentEventType.HOLD_FAILED;
            case "payment_intent.canceled" -> PaymentEventType.HOLD_CANCELED;
            case "payment_intent.succeeded" -> PaymentEventType.CAPTURE_CONFIRMED;
            case "charge.refunded" -> PaymentEventType.REFUNDED;
            default -> PaymentEventType.UNHANDLED;
        };
    }

    private Long bookingIdOf(JsonNode object) {
        String value = object.path("metadata").path("bookingId").asText(null);
        if (!StringUtils.hasText(value)) {
            return null;
        }
        try {
            return Long.valueOf(value);
        } catch (NumberFormatException e) {
            log.warn("Webhook metadata bookingId is not numeric: {}", value);
            return null;
        }
    }

    private Long amountOf(PaymentEventType type, JsonNode object) {
        JsonNode amount = switch (type) {
            case CAPTURE_CONFIRMED -> object.path("amount_received");
            case REFUNDED -> object.path("amount_refunded");
            default -> object.path("amount");
        };
        return amount.isNumber() ? amount.asLong() : null;
    }
}
