package personal.expert.core.booking.domain.model;

/**
 * 예약 종결 액션
 * 결제사 호출 전에 예약 행에 선점(claim)되며, 먼저 선점한 액션만 진행된다.
 */
public enum BookingAction {
    CONFIRM,
    DECLINE,
    CANCEL,
    EXPIRE
}
