package personal.expert.core.booking.domain.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import personal.expert.core.booking.application.port.in.PublishPendingEventsUseCase;
import personal.expert.core.booking.application.port.out.BookingEventPublisher;
import personal.expert.core.booking.application.port.out.OutboxEventRepository;
import personal.expert.core.booking.domain.model.BookingEventType;
import personal.expert.core.booking.domain.model.OutboxEvent;

import java.util.List;

/**
 * Outbox Event Service
 * 대기 중인 이벤트를 발행 처리하는 도메인 서비스
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class OutboxEventService implements PublishPendingEventsUseCase {

    private final OutboxEventRepository outboxEventRepository;
    private final BookingEventPublisher eventPublisher;

    @Override
    @Transactional
    public int publishPendingEvents() {
        List<OutboxEvent> pendingEvents = outboxEventRepository.findPendingEvents();
        int publishedCount = 0;

        for (OutboxEvent event : pendingEvents) {
            try {
                String topic = BookingEventType.valueOf(event.eventType()).topic();

                // Key: bookingId (같은 예약의 이벤트 순서 보장)
                String key = String.valueOf(event.aggregateId());

                log.debug("Publishing event: id={}, type={}, topic={}", event.id(), event.eventType(), topic);
                eventPublisher.publishRaw(topic, key, event.payload());

                outboxEventRepository.save(event.markAsPublished());
                publishedCount++;

            } catch (RuntimeException e) {
                log.error("Failed to publish event: id={}, retryCount={}", event.id(), event.retryCount(), e);
                outboxEventRepository.save(event.recordFailure());
            }
        }
        return publishedCount;
    }
}
