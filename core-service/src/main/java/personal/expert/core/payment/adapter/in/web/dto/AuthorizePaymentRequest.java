package personal.expert.core.payment.adapter.in.web.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import personal.expert.core.payment.application.port.in.AuthorizePaymentCommand;

/**
 * 결제 홀드 요청 DTO
 *
 * @param amount 통화 최소 단위 금액 (예: 5000 = 50.00 USD)
 */
public record AuthorizePaymentRequest(
        @NotNull(message = "예약 ID는 필수입니다.")
        Long bookingId,

        @NotNull(message = "금액은 필수입니다.")
        @Positive(message = "금액은 0보다 커야 합니다.")
        Long amount,

        @NotBlank(message = "통화는 필수입니다.")
        String currency
) {
    public AuthorizePaymentCommand toCommand(Long learnerId) {
        return new AuthorizePaymentCommand(bookingId, learnerId, amount, currency);
    }
}
