package personal.expert.core.payment.domain.model;

/**
 * 결제사 이벤트를 도메인 관점으로 분류한 종류
 */
public enum PaymentEventType {
    HOLD_SUCCEEDED,     // 홀드 확정 (매입 가능)
    HOLD_FAILED,        // 홀드 실패
    HOLD_CANCELED,      // 홀드 취소 (결제사 측)
    CAPTURE_CONFIRMED,  // 매입 확인
    REFUNDED,           // 환불 확인
    UNHANDLED           // 처리 대상 아님
}
