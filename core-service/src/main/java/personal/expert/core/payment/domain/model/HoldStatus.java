package personal.expert.core.payment.domain.model;

/**
 * 결제사가 보고한 홀드 상태
 */
public enum HoldStatus {
    /**
     * 결제 수단 확인 등 구매자 측 동작 대기 (webhook으로 결과 통지)
     */
    REQUIRES_CONFIRMATION,

    /**
     * 홀드 확정 (매입 가능)
     */
    AUTHORIZED
}
