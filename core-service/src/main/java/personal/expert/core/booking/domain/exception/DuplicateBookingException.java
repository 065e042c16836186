package personal.expert.core.booking.domain.exception;

import personal.expert.common.exception.BusinessException;
import personal.expert.common.exception.ErrorCode;

/**
 * Duplicate Booking Exception
 * 동일 학습자의 같은 슬롯 중복 예약
 */
public class DuplicateBookingException extends BusinessException {
    public DuplicateBookingException(Long slotId, Long learnerId) {
        super(ErrorCode.DUPLICATE_BOOKING,
                String.format("Learner already holds an active booking: slotId=%d, learnerId=%d", slotId, learnerId));
    }
}
