package personal.expert.core.booking.domain.exception;

import personal.expert.common.exception.BusinessException;
import personal.expert.common.exception.ErrorCode;
import personal.expert.core.booking.domain.model.BookingStatus;
import personal.expert.core.booking.domain.model.PaymentStatus;

/**
 * Invalid Booking State Exception
 * 요청한 액션을 수행할 수 없는 예약 상태
 */
public class InvalidBookingStateException extends BusinessException {
    public InvalidBookingStateException(Long bookingId, BookingStatus status, PaymentStatus paymentStatus) {
        super(ErrorCode.INVALID_BOOKING_STATE,
                String.format("Invalid booking state: bookingId=%d, status=%s, paymentStatus=%s", bookingId, status, paymentStatus));
    }
}
