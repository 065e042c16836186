package personal.expert.core.booking.domain.exception;

import personal.expert.common.exception.BusinessException;
import personal.expert.common.exception.ErrorCode;
import personal.expert.core.booking.domain.model.BookingAction;
import personal.expert.core.booking.domain.model.BookingStatus;

/**
 * Booking Already Resolved Exception
 * 다른 요청이 먼저 예약을 종결(또는 종결 선점)한 경우
 */
public class BookingAlreadyResolvedException extends BusinessException {
    public BookingAlreadyResolvedException(Long bookingId, BookingStatus status, BookingAction pendingAction) {
        super(ErrorCode.BOOKING_ALREADY_RESOLVED,
                String.format("Booking already resolved: bookingId=%d, status=%s, pendingAction=%s", bookingId, status, pendingAction));
    }
}
