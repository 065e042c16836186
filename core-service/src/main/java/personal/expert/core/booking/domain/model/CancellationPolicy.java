package personal.expert.core.booking.domain.model;

import personal.expert.core.booking.domain.exception.CancellationWindowClosedException;

import java.time.Duration;
import java.time.LocalDateTime;

/**
 * Cancellation Refund Policy
 * 매입 이후 취소 시 환불 금액 산정 규칙
 * <p>
 * 학습자 취소: 세션 시작 fullRefundBefore 이전이면 전액, partialRefundBefore 이전이면 일부,
 * 그 이후에는 취소 불가. 전문가/시스템 취소는 항상 전액 환불.
 */
public record CancellationPolicy(
        Duration fullRefundBefore,
        Duration partialRefundBefore,
        int partialRefundPercent) {

    public CancellationPolicy {
        if (fullRefundBefore.compareTo(partialRefundBefore) < 0) {
            throw new IllegalArgumentException("Full refund window must not be shorter than partial refund window");
        }
        if (partialRefundPercent < 0 || partialRefundPercent > 100) {
            throw new IllegalArgumentException("Partial refund percent must be within 0..100");
        }
    }

    /**
     * 환불 금액 계산
     *
     * @param booking 취소 대상 예약
     * @param actor   취소 주체
     * @param at      취소 요청 시각
     * @return 환불 금액 (매입 전이면 0)
     * @throws CancellationWindowClosedException 학습자 취소 가능 시간이 지난 경우
     */
    public long refundableAmount(Booking booking, CancelledBy actor, LocalDateTime at) {
        if (!booking.isCaptured()) {
            return 0L;
        }
        if (actor != CancelledBy.LEARNER) {
            return booking.amountCaptured();
        }

        Duration untilStart = Duration.between(at, booking.startAt());
        if (untilStart.compareTo(fullRefundBefore) >= 0) {
            return booking.amountCaptured();
        }
        if (untilStart.compareTo(partialRefundBefore) >= 0) {
            return booking.amountCaptured() * partialRefundPercent / 100;
        }
        throw new CancellationWindowClosedException(booking.id(), untilStart);
    }
}
