package personal.expert.core.booking.domain.model;

/**
 * 예약 라이프사이클 이벤트 종류와 발행 토픽
 */
public enum BookingEventType {
    BOOKING_CREATED("booking.created"),
    BOOKING_AUTHORIZED("booking.authorized"),
    BOOKING_CONFIRMED("booking.confirmed"),
    BOOKING_DECLINED("booking.declined"),
    BOOKING_CANCELLED("booking.cancelled"),
    BOOKING_COMPLETED("booking.completed");

    private final String topic;

    BookingEventType(String topic) {
        this.topic = topic;
    }

    public String topic() {
        return topic;
    }

    public static BookingEventType of(BookingStatus status) {
        return switch (status) {
            case PENDING -> BOOKING_CREATED;
            case PENDING_APPROVAL -> BOOKING_AUTHORIZED;
            case CONFIRMED -> BOOKING_CONFIRMED;
            case DECLINED -> BOOKING_DECLINED;
            case CANCELLED -> BOOKING_CANCELLED;
            case COMPLETED -> BOOKING_COMPLETED;
        };
    }
}
