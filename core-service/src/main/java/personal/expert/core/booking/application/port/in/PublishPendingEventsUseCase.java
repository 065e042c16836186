package personal.expert.core.booking.application.port.in;

/**
 * Publish Pending Events Use Case
 * Outbox의 대기 이벤트를 발행한다.
 */
public interface PublishPendingEventsUseCase {

    /**
     * @return 발행 성공 건수
     */
    int publishPendingEvents();
}
