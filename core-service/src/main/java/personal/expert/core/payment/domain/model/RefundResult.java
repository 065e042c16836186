package personal.expert.core.payment.domain.model;

/**
 * 환불 결과
 */
public record RefundResult(String refundReference, long amountRefunded) {
}
