package personal.expert.core.booking.application.port.in;

import personal.expert.core.booking.domain.model.Booking;

/**
 * 취소 결과
 *
 * @param booking      취소된 예약
 * @param refundAmount 환불 금액 (매입 전 취소는 0)
 */
public record CancellationResult(
        Booking booking,
        long refundAmount
) {
}
