package personal.expert.core.payment.domain.model;

/**
 * 서명 검증을 통과한 결제사 이벤트
 *
 * @param eventId       결제사 이벤트 ID (중복 제거 키)
 * @param type          도메인 이벤트 종류
 * @param rawType       결제사 원본 이벤트 타입
 * @param bookingId     메타데이터의 예약 ID (없을 수 있음)
 * @param holdReference 관련 홀드 식별자 (없을 수 있음)
 * @param amount        이벤트 금액 (매입/환불 금액, 없을 수 있음)
 */
public record PaymentEvent(
        String eventId,
        PaymentEventType type,
        String rawType,
        Long bookingId,
        String holdReference,
        Long amount) {
}
