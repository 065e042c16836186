package personal.expert.core.booking.adapter.in.web.dto;

import personal.expert.core.booking.application.port.in.CancellationResult;

/**
 * 예약 취소 응답 DTO
 */
public record CancellationResponse(
        BookingResponse booking,
        long refundAmount
) {
    public static CancellationResponse from(CancellationResult result) {
        return new CancellationResponse(BookingResponse.from(result.booking()), result.refundAmount());
    }
}
