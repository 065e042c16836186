package personal.expert.core.booking.domain.exception;

import personal.expert.common.exception.BusinessException;
import personal.expert.common.exception.ErrorCode;

/**
 * Booking Access Denied Exception
 * 예약에 대한 접근 권한이 없을 때 발생
 */
public class BookingAccessDeniedException extends BusinessException {
    public BookingAccessDeniedException(Long bookingId, Long actorId) {
        super(ErrorCode.FORBIDDEN,
                String.format("User %d does not have access to booking %d", actorId, bookingId));
    }
}
