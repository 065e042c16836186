package personal.expert.core.payment.adapter.out.persistence;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import personal.expert.core.payment.application.port.out.WebhookEventRepository;
import personal.expert.core.payment.domain.model.WebhookEvent;

import java.util.Optional;

/**
 * Webhook Event Persistence Adapter
 * INSERT를 즉시 flush하여 유니크 제약 위반이 호출 시점에 드러나도록 한다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class WebhookEventPersistenceAdapter implements WebhookEventRepository {

    private final JpaWebhookEventRepository jpaWebhookEventRepository;

    @Override
    public boolean existsByEventId(String eventId) {
        return jpaWebhookEventRepository.existsByEventId(eventId);
    }

    @Override
    public WebhookEvent append(WebhookEvent event) {
        log.debug("Recording webhook event: eventId={}, outcome={}", event.eventId(), event.outcome());
        return jpaWebhookEventRepository.saveAndFlush(WebhookEventEntity.fromDomain(event)).toDomain();
    }

    @Override
    public Optional<WebhookEvent> findByEventId(String eventId) {
        return jpaWebhookEventRepository.findByEventId(eventId)
                .map(WebhookEventEntity::toDomain);
    }

    @Override
    public long countByEventId(String eventId) {
        return jpaWebhookEventRepository.countByEventId(eventId);
    }
}
