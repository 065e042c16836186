package personal.expert.core.payment.domain.model;

/**
 * 홀드 해제 결과
 * 해제 요청 시점에 이미 매입된 홀드는 해제 대신 환불이 필요하다.
 *
 * @param alreadyCaptured 이미 매입되어 해제되지 않았는지
 * @param amountCaptured  매입된 금액 (alreadyCaptured인 경우)
 */
public record HoldCancellation(
        boolean alreadyCaptured,
        long amountCaptured) {

    public static HoldCancellation cancelled() {
        return new HoldCancellation(false, 0L);
    }

    public static HoldCancellation captured(long amountCaptured) {
        return new HoldCancellation(true, amountCaptured);
    }
}
