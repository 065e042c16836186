package personal.expert.core.booking.domain.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * Payment Status
 * 예약에 연결된 결제 상태
 */
public enum PaymentStatus {
    PENDING,      // 홀드 요청 전 또는 결제사 확인 대기
    AUTHORIZED,   // 홀드 확인 (매입 전)
    CAPTURED,     // 매입 완료
    CANCELLED,    // 홀드 해제
    FAILED,       // 홀드 실패
    REFUNDED;     // 매입 후 환불

    private static final Set<PaymentStatus> SETTLED_WITHOUT_CHARGE = EnumSet.of(CANCELLED, REFUNDED, FAILED);

    /**
     * 종료된 예약이 가질 수 있는 결제 상태인지
     */
    public boolean isReleased() {
        return SETTLED_WITHOUT_CHARGE.contains(this);
    }
}
