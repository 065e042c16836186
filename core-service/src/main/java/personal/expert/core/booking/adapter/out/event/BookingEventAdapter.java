package personal.expert.core.booking.adapter.out.event;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import personal.expert.core.booking.adapter.out.persistence.OutboxEventFactory;
import personal.expert.core.booking.application.port.out.BookingEventPort;
import personal.expert.core.booking.application.port.out.OutboxEventRepository;
import personal.expert.core.booking.domain.model.Booking;
import personal.expert.core.booking.domain.model.OutboxEvent;

/**
 * Booking Event Adapter
 * Outbox 패턴을 사용한 예약 이벤트 발행 구현체
 * 호출한 트랜잭션 안에서 저장되어 상태 변경과 함께 커밋/롤백된다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class BookingEventAdapter implements BookingEventPort {

    private final OutboxEventRepository outboxEventRepository;
    private final OutboxEventFactory outboxEventFactory;

    @Override
    public void publishStatusChanged(Booking booking) {
        OutboxEvent outboxEvent = outboxEventFactory.createStatusChangedEvent(booking);
        outboxEventRepository.save(outboxEvent);
        log.debug("Booking event recorded: bookingId={}, type={}", booking.id(), outboxEvent.eventType());
    }
}
