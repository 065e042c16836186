package personal.expert.core.payment.application.port.in;

import personal.expert.common.exception.BusinessException;
import personal.expert.common.exception.ErrorCode;

/**
 * Authorize Payment Command
 * 결제 홀드 요청 커맨드
 */
public record AuthorizePaymentCommand(
        Long bookingId,
        Long learnerId,
        long amount,
        String currency
) {
    public AuthorizePaymentCommand {
        if (bookingId == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Booking ID cannot be null");
        }
        if (learnerId == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Learner ID cannot be null");
        }
        if (amount <= 0) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Amount must be positive");
        }
        if (currency == null || currency.isBlank()) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Currency cannot be blank");
        }
    }
}
