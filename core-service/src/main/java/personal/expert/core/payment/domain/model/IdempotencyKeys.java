package personal.expert.core.payment.domain.model;

/**
 * 결제사 호출 멱등 키
 * 예약 ID와 의도한 결과로 구성되어 같은 의도의 재호출은 결제사에서 한 번만 처리된다.
 */
public final class IdempotencyKeys {

    private IdempotencyKeys() {
    }

    public static String authorize(Long bookingId) {
        return "authorize-" + bookingId;
    }

    public static String capture(Long bookingId) {
        return "capture-" + bookingId;
    }

    public static String cancel(Long bookingId) {
        return "cancel-" + bookingId;
    }

    public static String refund(Long bookingId) {
        return "refund-" + bookingId;
    }

    /**
     * 종결된 예약에 뒤늦게 생성된 홀드 해제
     */
    public static String voidHold(Long bookingId, String holdReference) {
        return "void-" + bookingId + "-" + holdReference;
    }
}
