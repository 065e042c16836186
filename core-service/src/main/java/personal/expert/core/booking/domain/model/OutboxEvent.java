package personal.expert.core.booking.domain.model;

import java.time.LocalDateTime;

/**
 * Outbox Event Domain Model
 * 예약 상태 변경과 같은 트랜잭션에 저장되어 이후 메시지 브로커로 전달되는 이벤트 (불변)
 */
public record OutboxEvent(
        Long id,
        String aggregateType,
        Long aggregateId,
        String eventType,
        String payload,
        OutboxEventStatus status,
        LocalDateTime createdAt,
        LocalDateTime publishedAt,
        int retryCount) {

    public static final int MAX_RETRY_COUNT = 3;

    public static OutboxEvent pending(String aggregateType, Long aggregateId, String eventType, String payload) {
        return new OutboxEvent(null, aggregateType, aggregateId, eventType, payload,
                OutboxEventStatus.PENDING, LocalDateTime.now(), null, 0);
    }

    public OutboxEvent markAsPublished() {
        return new OutboxEvent(id, aggregateType, aggregateId, eventType, payload,
                OutboxEventStatus.PUBLISHED, createdAt, LocalDateTime.now(), retryCount);
    }

    /**
     * 발행 실패 기록. 최대 재시도 횟수에 도달하면 FAILED로 전환한다.
     */
    public OutboxEvent recordFailure() {
        int retried = retryCount + 1;
        OutboxEventStatus next = retried >= MAX_RETRY_COUNT ? OutboxEventStatus.FAILED : OutboxEventStatus.PENDING;
        return new OutboxEvent(id, aggregateType, aggregateId, eventType, payload,
                next, createdAt, publishedAt, retried);
    }

    public enum OutboxEventStatus {
        PENDING,    // 발행 대기
        PUBLISHED,  // 발행 완료
        FAILED      // 발행 실패
    }
}
