package personal.expert.core.booking.adapter.in.web.dto;

import personal.expert.core.booking.application.port.in.SweepResult;

/**
 * 만료 정리 응답 DTO
 */
public record SweepResponse(
        int cancelledCount,
        int completedCount,
        int recoveredCount
) {
    public static SweepResponse from(SweepResult result) {
        return new SweepResponse(result.cancelledCount(), result.completedCount(), result.recoveredCount());
    }
}
