package personal.expert.core.payment.domain.model;

/**
 * 이벤트 반영 결과
 *
 * @param outcome            원장에 기록된 처리 결과 (중복이면 null)
 * @param duplicate          이미 처리된 이벤트인지
 * @param strayHoldReference 종결된 예약에 뒤늦게 승인된 홀드 (커밋 후 해제 대상)
 */
public record WebhookApplication(
        WebhookOutcome outcome,
        boolean duplicate,
        Long bookingId,
        String strayHoldReference) {

    public static WebhookApplication duplicated() {
        return new WebhookApplication(null, true, null, null);
    }

    public static WebhookApplication of(WebhookOutcome outcome, Long bookingId) {
        return new WebhookApplication(outcome, false, bookingId, null);
    }

    public static WebhookApplication strayHold(Long bookingId, String holdReference) {
        return new WebhookApplication(WebhookOutcome.DISCARDED, false, bookingId, holdReference);
    }

    public boolean hasStrayHold() {
        return strayHoldReference != null;
    }
}
