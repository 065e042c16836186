package personal.expert.core.payment.application.port.in;

import personal.expert.core.payment.domain.model.PaymentEvent;
import personal.expert.core.payment.domain.model.WebhookIngestResult;

/**
 * Ingest Webhook Use Case (Webhook Reconciler)
 */
public interface IngestWebhookUseCase {

    /**
     * 서명 검증 후 이벤트 처리
     *
     * @throws personal.expert.core.payment.domain.exception.InvalidWebhookSignatureException 서명 불일치
     */
    WebhookIngestResult ingest(IngestWebhookCommand command);

    /**
     * 검증된 이벤트 처리 (중복 제거 + 상태 반영)
     */
    WebhookIngestResult ingest(PaymentEvent event);
}
