package personal.expert.core.payment.domain.exception;

import personal.expert.common.exception.BusinessException;
import personal.expert.common.exception.ErrorCode;

/**
 * Payment Amount Mismatch Exception
 * 요청 금액/통화가 예약 금액과 다른 경우
 */
public class PaymentAmountMismatchException extends BusinessException {
    public PaymentAmountMismatchException(Long bookingId, long expected, String expectedCurrency,
                                          long requested, String requestedCurrency) {
        super(ErrorCode.AMOUNT_MISMATCH,
                String.format("Amount mismatch: bookingId=%d, expected=%d %s, requested=%d %s",
                        bookingId, expected, expectedCurrency, requested, requestedCurrency));
    }
}
