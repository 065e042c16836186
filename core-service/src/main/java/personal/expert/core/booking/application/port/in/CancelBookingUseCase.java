package personal.expert.core.booking.application.port.in;

/**
 * Cancel Booking Use Case
 * 학습자 또는 전문가의 예약 취소
 */
public interface CancelBookingUseCase {

    CancellationResult cancel(CancelBookingCommand command);
}
