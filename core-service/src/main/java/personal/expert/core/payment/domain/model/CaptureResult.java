package personal.expert.core.payment.domain.model;

/**
 * 매입 결과
 */
public record CaptureResult(long amountCaptured) {
}
