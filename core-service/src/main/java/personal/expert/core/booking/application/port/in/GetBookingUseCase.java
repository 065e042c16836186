package personal.expert.core.booking.application.port.in;

import personal.expert.core.booking.domain.model.Booking;

import java.util.List;

/**
 * Get Booking Use Case
 */
public interface GetBookingUseCase {

    /**
     * 예약 조회 (학습자 또는 담당 전문가만)
     */
    Booking getBooking(Long bookingId, Long userId);

    List<Booking> getPendingApprovals(Long expertId);
}
