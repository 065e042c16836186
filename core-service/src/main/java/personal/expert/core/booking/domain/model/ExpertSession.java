package personal.expert.core.booking.domain.model;

import personal.expert.common.exception.BusinessException;
import personal.expert.common.exception.ErrorCode;

import java.util.Locale;

/**
 * Expert Session Domain Model
 * 전문가가 제공하는 세션 상품. 금액은 통화의 최소 단위(minor unit)로 표현한다.
 */
public record ExpertSession(
        Long id,
        Long expertId,
        String title,
        long priceAmount,
        String currency) {

    public ExpertSession {
        if (expertId == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Expert ID cannot be null");
        }
        if (priceAmount <= 0) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Session price must be positive");
        }
        if (currency == null || currency.isBlank()) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Currency cannot be blank");
        }
        currency = currency.toLowerCase(Locale.ROOT);
    }
}
