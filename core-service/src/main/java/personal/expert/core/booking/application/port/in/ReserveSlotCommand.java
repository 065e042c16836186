package personal.expert.core.booking.application.port.in;

import personal.expert.common.exception.BusinessException;
import personal.expert.common.exception.ErrorCode;

/**
 * Reserve Slot Command
 * 슬롯 예약 커맨드
 */
public record ReserveSlotCommand(
        Long learnerId,
        Long slotId,
        Long sessionId,
        String notes
) {
    public static final int MAX_NOTES_LENGTH = 500;

    public ReserveSlotCommand {
        if (learnerId == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Learner ID cannot be null");
        }
        if (slotId == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Slot ID cannot be null");
        }
        if (sessionId == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Session ID cannot be null");
        }
        if (notes != null && notes.length() > MAX_NOTES_LENGTH) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Notes exceed " + MAX_NOTES_LENGTH + " characters");
        }
    }
}
