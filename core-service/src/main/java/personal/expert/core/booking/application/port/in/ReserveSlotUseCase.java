package personal.expert.core.booking.application.port.in;

import personal.expert.core.booking.domain.model.Booking;

/**
 * Reserve Slot Use Case
 * 슬롯을 원자적으로 선점하고 PENDING 예약을 생성한다.
 */
public interface ReserveSlotUseCase {

    Booking reserve(ReserveSlotCommand command);
}
