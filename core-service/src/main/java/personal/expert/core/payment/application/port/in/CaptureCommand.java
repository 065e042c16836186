package personal.expert.core.payment.application.port.in;

import personal.expert.common.exception.BusinessException;
import personal.expert.common.exception.ErrorCode;

/**
 * Capture Command
 *
 * @param amountToCapture 부분 매입 금액 (null이면 홀드 전액). 남은 금액은 결제사가 구매자에게 해제한다.
 * @param notes           전문가 메모
 */
public record CaptureCommand(
        Long bookingId,
        Long amountToCapture,
        String notes
) {
    public CaptureCommand {
        if (bookingId == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Booking ID cannot be null");
        }
        if (amountToCapture != null && amountToCapture <= 0) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Amount to capture must be positive");
        }
    }

    public static CaptureCommand full(Long bookingId, String notes) {
        return new CaptureCommand(bookingId, null, notes);
    }
}
