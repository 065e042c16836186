package personal.expert.core.booking.adapter.in.web.dto;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import personal.expert.core.booking.application.port.in.ReserveSlotCommand;

/**
 * 슬롯 예약 요청 DTO
 */
public record ReserveSlotRequest(
        @NotNull(message = "슬롯 ID는 필수입니다.")
        Long slotId,

        @NotNull(message = "세션 ID는 필수입니다.")
        Long sessionId,

        @Size(max = 500, message = "메모는 500자 이하여야 합니다.")
        String notes
) {
    public ReserveSlotCommand toCommand(Long learnerId) {
        return new ReserveSlotCommand(learnerId, slotId, sessionId, notes);
    }
}
