package personal.expert.core.booking.domain.exception;

import personal.expert.common.exception.BusinessException;
import personal.expert.common.exception.ErrorCode;

/**
 * Concurrent Reservation Exception
 * 동시 예약 충돌 (재시도 후에도 해소되지 않은 경우)
 */
public class ConcurrentReservationException extends BusinessException {
    public ConcurrentReservationException(Long slotId) {
        super(ErrorCode.CONCURRENT_RESERVATION,
                String.format("Concurrent reservation conflict: slotId=%d", slotId));
    }
}
