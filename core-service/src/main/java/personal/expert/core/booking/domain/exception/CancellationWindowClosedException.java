package personal.expert.core.booking.domain.exception;

import personal.expert.common.exception.BusinessException;
import personal.expert.common.exception.ErrorCode;

import java.time.Duration;

/**
 * Cancellation Window Closed Exception
 * 학습자 취소 가능 시간이 지난 경우
 */
public class CancellationWindowClosedException extends BusinessException {
    public CancellationWindowClosedException(Long bookingId, Duration untilStart) {
        super(ErrorCode.CANCELLATION_WINDOW_CLOSED,
                String.format("Cancellation window closed: bookingId=%d, untilStart=%s", bookingId, untilStart));
    }
}
