package personal.expert.core.payment.domain.model;

/**
 * Webhook 처리 결과 (원장 기록용)
 */
public enum WebhookOutcome {
    APPLIED,    // 예약 상태에 반영
    DISCARDED,  // 예상 이전 상태가 아니어서 폐기
    IGNORED,    // 처리 대상이 아닌 이벤트
    FAILED      // 예약을 찾지 못하는 등 처리 실패 (수신은 확인)
}
