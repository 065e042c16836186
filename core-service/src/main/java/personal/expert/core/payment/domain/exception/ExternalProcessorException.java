package personal.expert.core.payment.domain.exception;

import personal.expert.common.exception.BusinessException;
import personal.expert.common.exception.ErrorCode;

/**
 * External Processor Exception
 * 결제사 호출 실패. 사용자에게는 일반 메시지만 노출하고 상세 원인은 로그로 남긴다.
 */
public abstract class ExternalProcessorException extends BusinessException {

    protected ExternalProcessorException(ErrorCode errorCode, String operation, String reference, Throwable cause) {
        super(errorCode,
                String.format("Payment processor %s failed: reference=%s, cause=%s",
                        operation, reference, cause != null ? cause.getMessage() : "n/a"),
                cause);
    }
}
