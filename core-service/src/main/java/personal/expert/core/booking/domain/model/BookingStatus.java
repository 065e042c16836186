package personal.expert.core.booking.domain.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * Booking Status
 * 예약 상태
 */
public enum BookingStatus {
    /**
     * 슬롯 선점 완료, 결제 홀드 대기
     */
    PENDING,

    /**
     * 결제 홀드 확인, 전문가 승인 대기
     */
    PENDING_APPROVAL,

    /**
     * 전문가 승인 및 결제 매입 완료
     */
    CONFIRMED,

    /**
     * 전문가 거절 (종료)
     */
    DECLINED,

    /**
     * 취소 또는 만료 (종료)
     */
    CANCELLED,

    /**
     * 세션 종료 (종료)
     */
    COMPLETED;

    private static final Set<BookingStatus> ACTIVE = EnumSet.of(PENDING, PENDING_APPROVAL, CONFIRMED);
    private static final Set<BookingStatus> TERMINAL = EnumSet.of(DECLINED, CANCELLED, COMPLETED);

    /**
     * 슬롯을 점유하고 있는 상태인지
     */
    public boolean isActive() {
        return ACTIVE.contains(this);
    }

    public boolean isTerminal() {
        return TERMINAL.contains(this);
    }

    public static Set<BookingStatus> activeStatuses() {
        return EnumSet.copyOf(ACTIVE);
    }
}
