package personal.expert.core.booking.adapter.out.persistence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import personal.expert.common.exception.BusinessException;
import personal.expert.common.exception.ErrorCode;
import personal.expert.core.booking.domain.model.Booking;
import personal.expert.core.booking.domain.model.BookingEventType;
import personal.expert.core.booking.domain.model.OutboxEvent;

/**
 * Outbox Event Factory (Adapter Layer)
 * Booking을 OutboxEvent로 변환하는 팩토리
 * Infrastructure 관심사를 캡슐화
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class OutboxEventFactory {

    public static final String AGGREGATE_TYPE = "BOOKING";

    private final ObjectMapper objectMapper;

    /**
     * 현재 예약 상태에 대응하는 라이프사이클 이벤트 생성
     */
    public OutboxEvent createStatusChangedEvent(Booking booking) {
        BookingEventType eventType = BookingEventType.of(booking.status());
        try {
            BookingStatusChangedEvent event = new BookingStatusChangedEvent(
                    booking.id(),
                    eventType.name(),
                    booking.learnerId(),
                    booking.expertId(),
                    booking.slotId(),
                    booking.status().name(),
                    booking.paymentStatus().name(),
                    booking.amount(),
                    booking.currency(),
                    booking.amountCaptured(),
                    booking.amountRefunded(),
                    booking.cancelledBy() != null ? booking.cancelledBy().name() : null,
                    booking.startAt().toString(),
                    booking.updatedAt().toString());

            String payload = objectMapper.writeValueAsString(event);
            return OutboxEvent.pending(AGGREGATE_TYPE, booking.id(), eventType.name(), payload);

        } catch (JsonProcessingException e) {
            log.error("Failed to create outbox event: bookingId={}, type={}", booking.id(), eventType, e);
            throw new BusinessException(ErrorCode.INTERNAL_SERVER_ERROR, "Failed to create outbox event", e);
        }
    }

    /**
     * Kafka 이벤트 DTO
     */
    public record BookingStatusChangedEvent(
            Long bookingId,
            String eventType,
            Long learnerId,
            Long expertId,
            Long slotId,
            String status,
            String paymentStatus,
            long amount,
            String currency,
            long amountCaptured,
            long amountRefunded,
            String cancelledBy,
            String startAt,
            String occurredAt) {
    }
}
