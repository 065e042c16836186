package personal.expert.core.booking.application.port.in;

import personal.expert.core.booking.domain.model.Slot;

import java.util.List;

/**
 * Get Available Slots Use Case
 * 세션의 예약 가능 슬롯 조회 (예약 가능 시간 범위 내, 잔여 수량 있음)
 */
public interface GetAvailableSlotsUseCase {

    List<Slot> getAvailableSlots(Long sessionId);
}
