package personal.expert.core.payment.domain.exception;

import personal.expert.common.exception.ErrorCode;

/**
 * Payment Processor Unavailable Exception
 * 네트워크 오류, 결제사 장애, Circuit Open 등 일시적 실패
 */
public class PaymentProcessorUnavailableException extends ExternalProcessorException {
    public PaymentProcessorUnavailableException(String operation, String reference, Throwable cause) {
        super(ErrorCode.PAYMENT_PROCESSOR_UNAVAILABLE, operation, reference, cause);
    }
}
