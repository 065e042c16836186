package personal.expert.core.payment.domain.exception;

import personal.expert.common.exception.BusinessException;
import personal.expert.common.exception.ErrorCode;

/**
 * Unsupported Currency Exception
 */
public class UnsupportedCurrencyException extends BusinessException {
    public UnsupportedCurrencyException(String currency) {
        super(ErrorCode.UNSUPPORTED_CURRENCY, "Unsupported currency: " + currency);
    }
}
