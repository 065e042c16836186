package personal.expert.core.booking.adapter.in.web.dto;

import personal.expert.core.booking.domain.model.Slot;

import java.time.LocalDateTime;

/**
 * 예약 가능 슬롯 응답 DTO
 */
public record SlotResponse(
        Long slotId,
        Long expertId,
        Long sessionId,
        LocalDateTime startAt,
        LocalDateTime endAt,
        int capacity,
        int remainingCapacity
) {
    public static SlotResponse from(Slot slot) {
        return new SlotResponse(
                slot.id(),
                slot.expertId(),
                slot.sessionId(),
                slot.startAt(),
                slot.endAt(),
                slot.capacity(),
                slot.remainingCapacity()
        );
    }
}
