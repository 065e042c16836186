package personal.expert.core.booking.application.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import personal.expert.core.booking.application.port.in.ResolveBookingCommand;
import personal.expert.core.booking.application.port.in.ResolveBookingUseCase;
import personal.expert.core.booking.application.port.out.BookingRepository;
import personal.expert.core.booking.domain.exception.BookingAlreadyResolvedException;
import personal.expert.core.booking.domain.exception.BookingNotFoundException;
import personal.expert.core.booking.domain.exception.InvalidBookingStateException;
import personal.expert.core.booking.domain.model.Booking;
import personal.expert.core.booking.domain.model.BookingAction;
import personal.expert.core.booking.domain.model.BookingStatus;
import personal.expert.core.payment.application.port.in.CaptureCommand;
import personal.expert.core.payment.application.port.in.ReleaseCommand;
import personal.expert.core.payment.application.port.in.SettlePaymentUseCase;

/**
 * Booking Approval Service (Approval Workflow)
 * 전문가의 승인/거절 결정을 결제 매입/해제로 연결한다.
 * <p>
 * 승인(CONFIRM): 홀드 매입 -> CONFIRMED / CAPTURED
 * 거절(DECLINE): 홀드 해제 -> DECLINED / CANCELLED, 슬롯 수량 반환
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BookingApprovalService implements ResolveBookingUseCase {

    private static final String DEFAULT_DECLINE_REASON = "declined by expert";

    private final BookingRepository bookingRepository;
    private final SettlePaymentUseCase settlePaymentUseCase;

    @Override
    public Booking resolve(ResolveBookingCommand command) {
        Booking booking = load(command.bookingId());
        booking.ensureExpert(command.actorId());

        BookingAction action = command.decision() == ResolveBookingCommand.Decision.CONFIRM
                ? BookingAction.CONFIRM
                : BookingAction.DECLINE;

        // 이미 확정/종결된 예약은 409, 아직 홀드 확인 전이면 400
        if (booking.status() == BookingStatus.CONFIRMED || booking.status().isTerminal()) {
            throw new BookingAlreadyResolvedException(booking.id(), booking.status(), action);
        }
        if (booking.status() != BookingStatus.PENDING_APPROVAL) {
            throw new InvalidBookingStateException(booking.id(), booking.status(), booking.paymentStatus());
        }

        switch (command.decision()) {
            case CONFIRM -> settlePaymentUseCase.capture(CaptureCommand.full(booking.id(), command.notes()));
            case DECLINE -> settlePaymentUseCase.release(ReleaseCommand.decline(
                    booking.id(),
                    command.reason() != null ? command.reason() : DEFAULT_DECLINE_REASON,
                    command.notes()));
        }

        Booking resolved = load(booking.id());
        log.info("Booking resolved: bookingId={}, decision={}, status={}, paymentStatus={}",
                resolved.id(), command.decision(), resolved.status(), resolved.paymentStatus());
        return resolved;
    }

    private Booking load(Long bookingId) {
        return bookingRepository.findById(bookingId)
                .orElseThrow(() -> new BookingNotFoundException(bookingId));
    }
}
