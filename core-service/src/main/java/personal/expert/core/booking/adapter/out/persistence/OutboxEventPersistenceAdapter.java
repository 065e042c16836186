package personal.expert.core.booking.adapter.out.persistence;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import personal.expert.core.booking.application.port.out.OutboxEventRepository;
import personal.expert.core.booking.domain.model.OutboxEvent;

import java.util.List;

/**
 * Outbox Event Persistence Adapter
 * OutboxEventRepository 구현체
 */
@Component
@RequiredArgsConstructor
public class OutboxEventPersistenceAdapter implements OutboxEventRepository {

    private final JpaOutboxEventRepository jpaOutboxEventRepository;

    @Override
    public OutboxEvent save(OutboxEvent outboxEvent) {
        OutboxEventEntity saved = jpaOutboxEventRepository.save(OutboxEventEntity.fromDomain(outboxEvent));
        return saved.toDomain();
    }

    @Override
    public List<OutboxEvent> findPendingEvents() {
        return jpaOutboxEventRepository.findTop100ByStatusAndRetryCountLessThanOrderByIdAsc(
                        OutboxEvent.OutboxEventStatus.PENDING,
                        OutboxEvent.MAX_RETRY_COUNT)
                .stream()
                .map(OutboxEventEntity::toDomain)
                .toList();
    }
}
