package personal.expert.core.booking.application.port.in;

import personal.expert.common.exception.BusinessException;
import personal.expert.common.exception.ErrorCode;

/**
 * Resolve Booking Command
 * 전문가 승인/거절 커맨드
 */
public record ResolveBookingCommand(
        Long bookingId,
        Long actorId,
        Decision decision,
        String notes,
        String reason
) {
    public static final int MAX_TEXT_LENGTH = 500;

    public ResolveBookingCommand {
        if (bookingId == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Booking ID cannot be null");
        }
        if (actorId == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Actor ID cannot be null");
        }
        if (decision == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Decision cannot be null");
        }
        if (notes != null && notes.length() > MAX_TEXT_LENGTH) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Notes exceed " + MAX_TEXT_LENGTH + " characters");
        }
        if (reason != null && reason.length() > MAX_TEXT_LENGTH) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Reason exceeds " + MAX_TEXT_LENGTH + " characters");
        }
    }

    public enum Decision {
        CONFIRM,
        DECLINE
    }
}
