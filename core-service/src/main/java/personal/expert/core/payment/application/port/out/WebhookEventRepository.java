package personal.expert.core.payment.application.port.out;

import personal.expert.core.payment.domain.model.WebhookEvent;

import java.util.Optional;

/**
 * Webhook Event Ledger Port
 * event_id 유니크 제약으로 중복을 판별한다. 같은 event_id의 두 번째 기록은
 * DataIntegrityViolationException으로 실패한다.
 */
public interface WebhookEventRepository {

    boolean existsByEventId(String eventId);

    WebhookEvent append(WebhookEvent event);

    Optional<WebhookEvent> findByEventId(String eventId);

    long countByEventId(String eventId);
}
