package personal.expert.core.booking.adapter.in.web.dto;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import personal.expert.core.booking.application.port.in.ResolveBookingCommand;

/**
 * 전문가 승인/거절 요청 DTO
 */
public record ResolveBookingRequest(
        @NotNull(message = "action은 CONFIRM 또는 DECLINE 이어야 합니다.")
        ResolveBookingCommand.Decision action,

        @Size(max = 500, message = "메모는 500자 이하여야 합니다.")
        String notes,

        @Size(max = 500, message = "사유는 500자 이하여야 합니다.")
        String reason
) {
    public ResolveBookingCommand toCommand(Long bookingId, Long expertId) {
        return new ResolveBookingCommand(bookingId, expertId, action, notes, reason);
    }
}
