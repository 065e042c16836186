package personal.expert.core.booking.application.port.in;

import personal.expert.common.exception.BusinessException;
import personal.expert.common.exception.ErrorCode;

/**
 * Cancel Booking Command
 */
public record CancelBookingCommand(
        Long bookingId,
        Long actorId,
        String reason
) {
    public static final int MAX_REASON_LENGTH = 500;

    public CancelBookingCommand {
        if (bookingId == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Booking ID cannot be null");
        }
        if (actorId == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Actor ID cannot be null");
        }
        if (reason == null || reason.isBlank()) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Cancellation reason is required");
        }
        if (reason.length() > MAX_REASON_LENGTH) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Reason exceeds " + MAX_REASON_LENGTH + " characters");
        }
    }
}
