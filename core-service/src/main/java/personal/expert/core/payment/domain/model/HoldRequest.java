package personal.expert.core.payment.domain.model;

/**
 * 결제 홀드 요청 (수동 매입)
 */
public record HoldRequest(
        Long bookingId,
        long amount,
        String currency,
        String idempotencyKey) {

    public static HoldRequest of(Long bookingId, long amount, String currency) {
        return new HoldRequest(bookingId, amount, currency, IdempotencyKeys.authorize(bookingId));
    }
}
