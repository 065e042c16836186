package personal.expert.core.payment.domain.exception;

import personal.expert.common.exception.BusinessException;
import personal.expert.common.exception.ErrorCode;

/**
 * Invalid Webhook Signature Exception
 * 서명 헤더 누락/불일치. 어떤 상태도 변경하기 전에 발생한다.
 */
public class InvalidWebhookSignatureException extends BusinessException {
    public InvalidWebhookSignatureException(String reason) {
        super(ErrorCode.INVALID_WEBHOOK_SIGNATURE, "Webhook signature rejected: " + reason);
    }

    public InvalidWebhookSignatureException(String reason, Throwable cause) {
        super(ErrorCode.INVALID_WEBHOOK_SIGNATURE, "Webhook signature rejected: " + reason, cause);
    }
}
