package personal.expert.core.payment.domain.model;

import java.time.LocalDateTime;

/**
 * Webhook Event Ledger Entry
 * 결제사 이벤트 ID 기준 중복 제거 원장 (추가 전용, 생성 후 변경 없음)
 */
public record WebhookEvent(
        Long id,
        String eventId,
        String eventType,
        Long bookingId,
        WebhookOutcome outcome,
        String errorMessage,
        LocalDateTime receivedAt) {

    public static WebhookEvent record(PaymentEvent event, Long bookingId, WebhookOutcome outcome,
                                      String errorMessage, LocalDateTime now) {
        return new WebhookEvent(null, event.eventId(), event.rawType(), bookingId, outcome, errorMessage, now);
    }
}
