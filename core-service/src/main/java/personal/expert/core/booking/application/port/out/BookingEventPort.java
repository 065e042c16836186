package personal.expert.core.booking.application.port.out;

import personal.expert.core.booking.domain.model.Booking;

/**
 * Booking Event Port
 * 예약 상태 변경 이벤트를 현재 트랜잭션의 Outbox에 기록한다.
 */
public interface BookingEventPort {

    void publishStatusChanged(Booking booking);
}
