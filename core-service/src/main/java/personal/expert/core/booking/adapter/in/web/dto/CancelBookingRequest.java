package personal.expert.core.booking.adapter.in.web.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import personal.expert.core.booking.application.port.in.CancelBookingCommand;

/**
 * 예약 취소 요청 DTO
 */
public record CancelBookingRequest(
        @NotBlank(message = "취소 사유는 필수입니다.")
        @Size(max = 500, message = "사유는 500자 이하여야 합니다.")
        String reason
) {
    public CancelBookingCommand toCommand(Long bookingId, Long actorId) {
        return new CancelBookingCommand(bookingId, actorId, reason);
    }
}
