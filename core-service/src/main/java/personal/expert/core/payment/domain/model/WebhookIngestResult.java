package personal.expert.core.payment.domain.model;

/**
 * Webhook 수신 결과. 두 경우 모두 결제사에는 성공으로 응답한다.
 */
public enum WebhookIngestResult {
    ACCEPTED,
    DUPLICATE;

    public boolean isDuplicate() {
        return this == DUPLICATE;
    }
}
