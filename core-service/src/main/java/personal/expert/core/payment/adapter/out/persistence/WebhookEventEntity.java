package personal.expert.core.payment.adapter.out.persistence;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import personal.expert.core.payment.domain.model.WebhookEvent;
import personal.expert.core.payment.domain.model.WebhookOutcome;

import java.time.LocalDateTime;

/**
 * Webhook Event JPA Entity
 * 결제사 이벤트 원장. event_id 유니크 제약이 중복 처리를 막는다.
 */
@Entity
@Table(name = "webhook_events",
        uniqueConstraints = @UniqueConstraint(
                name = "uk_event_id",
                columnNames = {"event_id"}
        ),
        indexes = @Index(name = "idx_booking_id", columnList = "booking_id"))
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class WebhookEventEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "event_id", nullable = false, length = 100, updatable = false)
    private String eventId;

    @Column(name = "event_type", nullable = false, length = 100, updatable = false)
    private String eventType;

    @Column(name = "booking_id", updatable = false)
    private Long bookingId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20, updatable = false)
    private WebhookOutcome outcome;

    @Column(name = "error_message", length = 500, updatable = false)
    private String errorMessage;

    @Column(name = "received_at", nullable = false, updatable = false)
    private LocalDateTime receivedAt;

    public static WebhookEventEntity fromDomain(WebhookEvent event) {
        WebhookEventEntity entity = new WebhookEventEntity();
        entity.eventId = event.eventId();
        entity.eventType = event.eventType();
        entity.bookingId = event.bookingId();
        entity.outcome = event.outcome();
        entity.errorMessage = truncate(event.errorMessage());
        entity.receivedAt = event.receivedAt();
        return entity;
    }

    public WebhookEvent toDomain() {
        return new WebhookEvent(id, eventId, eventType, bookingId, outcome, errorMessage, receivedAt);
    }

    private static String truncate(String message) {
        if (message == null || message.length() <= 500) {
            return message;
        }
        return message.substring(0, 500);
    }
}
