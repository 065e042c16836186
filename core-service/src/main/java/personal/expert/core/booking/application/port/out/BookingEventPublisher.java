package personal.expert.core.booking.application.port.out;

/**
 * Booking Event Publisher Port
 * Outbox에 저장된 이벤트를 메시지 브로커로 전달한다.
 */
public interface BookingEventPublisher {

    /**
     * 직렬화된 이벤트를 그대로 발행 (전송 완료까지 대기)
     */
    void publishRaw(String topic, String key, String payload);
}
