package personal.expert.core.payment.adapter.out.persistence;

import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;

/**
 * Spring Data JPA Repository for WebhookEvent
 */
public interface JpaWebhookEventRepository extends JpaRepository<WebhookEventEntity, Long> {

    boolean existsByEventId(String eventId);

    Optional<WebhookEventEntity> findByEventId(String eventId);

    long countByEventId(String eventId);
}
