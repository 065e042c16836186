package personal.expert.core.payment.domain.model;

/**
 * 결제 홀드 생성 결과
 *
 * @param holdReference 결제사 홀드 식별자
 * @param clientSecret  구매자가 결제를 확정하는 데 쓰는 비밀 값 (저장하지 않음)
 * @param status        결제사 기준 홀드 상태
 */
public record PaymentHold(
        String holdReference,
        String clientSecret,
        HoldStatus status) {

    public boolean isAuthorized() {
        return status == HoldStatus.AUTHORIZED;
    }
}
