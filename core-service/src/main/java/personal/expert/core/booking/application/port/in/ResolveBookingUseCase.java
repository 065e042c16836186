package personal.expert.core.booking.application.port.in;

import personal.expert.core.booking.domain.model.Booking;

/**
 * Resolve Booking Use Case (Approval Workflow)
 * 승인 대기 예약을 확정(매입) 또는 거절(홀드 해제/환불)한다.
 */
public interface ResolveBookingUseCase {

    Booking resolve(ResolveBookingCommand command);
}
