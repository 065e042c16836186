package personal.expert.core.payment.application.port.in;

import personal.expert.common.exception.BusinessException;
import personal.expert.common.exception.ErrorCode;
import personal.expert.core.booking.domain.model.BookingAction;
import personal.expert.core.booking.domain.model.CancelledBy;

import java.time.LocalDateTime;

/**
 * Release Command
 * 홀드 해제 또는 환불로 예약을 종결하는 커맨드.
 * action이 DECLINE이면 DECLINED, CANCEL/EXPIRE이면 CANCELLED로 종결된다.
 *
 * @param requestedAt 요청 기준 시각 (null이면 현재 시각)
 */
public record ReleaseCommand(
        Long bookingId,
        BookingAction action,
        CancelledBy actor,
        String reason,
        String notes,
        LocalDateTime requestedAt
) {
    public ReleaseCommand {
        if (bookingId == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Booking ID cannot be null");
        }
        if (action == null || action == BookingAction.CONFIRM) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Release requires DECLINE, CANCEL or EXPIRE");
        }
        if (actor == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Actor cannot be null");
        }
    }

    public static ReleaseCommand decline(Long bookingId, String reason, String notes) {
        return new ReleaseCommand(bookingId, BookingAction.DECLINE, CancelledBy.EXPERT, reason, notes, null);
    }

    public static ReleaseCommand cancel(Long bookingId, CancelledBy actor, String reason) {
        return new ReleaseCommand(bookingId, BookingAction.CANCEL, actor, reason, null, null);
    }

    public static ReleaseCommand expire(Long bookingId, LocalDateTime now) {
        return new ReleaseCommand(bookingId, BookingAction.EXPIRE, CancelledBy.SYSTEM, "hold expired", null, now);
    }
}
