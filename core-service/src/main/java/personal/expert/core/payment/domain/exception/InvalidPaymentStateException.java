package personal.expert.core.payment.domain.exception;

import personal.expert.common.exception.BusinessException;
import personal.expert.common.exception.ErrorCode;
import personal.expert.core.booking.domain.model.PaymentStatus;

/**
 * Invalid Payment State Exception
 * 현재 결제 상태에서 허용되지 않는 결제 요청
 */
public class InvalidPaymentStateException extends BusinessException {
    public InvalidPaymentStateException(Long bookingId, PaymentStatus paymentStatus, String operation) {
        super(ErrorCode.INVALID_PAYMENT_STATE,
                String.format("Cannot %s payment in %s state: bookingId=%d", operation, paymentStatus, bookingId));
    }
}
