package personal.expert.core.payment.domain.exception;

import personal.expert.common.exception.ErrorCode;

/**
 * Payment Declined Exception
 * 카드 거절, 잘못된 요청 등 요청 측 원인으로 결제사가 거부한 경우 (재시도 무의미)
 */
public class PaymentDeclinedException extends ExternalProcessorException {
    public PaymentDeclinedException(String operation, String reference, Throwable cause) {
        super(ErrorCode.PAYMENT_DECLINED, operation, reference, cause);
    }
}
