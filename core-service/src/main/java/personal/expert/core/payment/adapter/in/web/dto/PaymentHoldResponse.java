package personal.expert.core.payment.adapter.in.web.dto;

import personal.expert.core.payment.domain.model.HoldStatus;
import personal.expert.core.payment.domain.model.PaymentHold;

/**
 * 결제 홀드 응답 DTO
 */
public record PaymentHoldResponse(
        String holdReference,
        String clientSecret,
        HoldStatus status
) {
    public static PaymentHoldResponse from(PaymentHold hold) {
        return new PaymentHoldResponse(hold.holdReference(), hold.clientSecret(), hold.status());
    }
}
