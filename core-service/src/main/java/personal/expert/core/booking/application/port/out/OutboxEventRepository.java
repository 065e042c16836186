package personal.expert.core.booking.application.port.out;

import personal.expert.core.booking.domain.model.OutboxEvent;

import java.util.List;

/**
 * Outbox Event Repository Port
 */
public interface OutboxEventRepository {

    OutboxEvent save(OutboxEvent outboxEvent);

    /**
     * 발행 대기 중인 이벤트 (재시도 횟수 제한 이내, 생성 순)
     */
    List<OutboxEvent> findPendingEvents();
}
