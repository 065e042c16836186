package personal.expert.core.support;

import com.stripe.net.Webhook;

import java.security.GeneralSecurityException;
import java.time.Instant;

/**
 * 테스트용 Stripe-Signature 헤더 생성 (t={timestamp},v1={HMAC-SHA256})
 */
public final class StripeWebhookSigner {

    public static final String TEST_SECRET = "whsec_test_secret";

    private StripeWebhookSigner() {
    }

    public static String sign(String payload) {
        return sign(payload, TEST_SECRET, Instant.now().getEpochSecond());
    }

    public static String sign(String payload, String secret, long timestamp) {
        try {
            String signature = Webhook.Util.computeHmacSha256(secret, timestamp + "." + payload);
            return "t=" + timestamp + ",v1=" + signature;
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Unable to sign webhook payload", e);
        }
    }

    public static String holdSucceeded(String eventId, Long bookingId, String holdReference, long amount) {
        return paymentIntentEvent(eventId, "payment_intent.amount_capturable_updated", bookingId, holdReference,
                "\"amount\":" + amount);
    }

    public static String holdFailed(String eventId, Long bookingId, String holdReference) {
        return paymentIntentEvent(eventId, "payment_intent.payment_failed", bookingId, holdReference,
                "\"amount\":0");
    }

    private static String paymentIntentEvent(String eventId, String type, Long bookingId, String holdReference,
                                             String amountField) {
        return "{\"id\":\"" + eventId + "\",\"object\":\"event\",\"type\":\"" + type + "\","
                + "\"data\":{\"object\":{\"id\":\"" + holdReference + "\",\"object\":\"payment_intent\","
                + amountField + ",\"metadata\":{\"bookingId\":\"" + bookingId + "\"}}}}";
    }
}
