package personal.expert.core.booking.application.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import personal.expert.core.booking.application.port.in.CancelBookingCommand;
import personal.expert.core.booking.application.port.in.CancelBookingUseCase;
import personal.expert.core.booking.application.port.in.CancellationResult;
import personal.expert.core.booking.application.port.out.BookingRepository;
import personal.expert.core.booking.domain.exception.BookingNotFoundException;
import personal.expert.core.booking.domain.exception.InvalidBookingStateException;
import personal.expert.core.booking.domain.model.Booking;
import personal.expert.core.booking.domain.model.CancelledBy;
import personal.expert.core.payment.application.port.in.ReleaseCommand;
import personal.expert.core.payment.application.port.in.SettlePaymentUseCase;
import personal.expert.core.payment.domain.model.Receipt;

/**
 * Booking Cancellation Service
 * 학습자/전문가 취소. 매입 전이면 홀드 해제, 매입 후면 환불 정책에 따라 환불한다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BookingCancellationService implements CancelBookingUseCase {

    private final BookingRepository bookingRepository;
    private final SettlePaymentUseCase settlePaymentUseCase;

    @Override
    public CancellationResult cancel(CancelBookingCommand command) {
        Booking booking = load(command.bookingId());
        CancelledBy actor = booking.cancellerOf(command.actorId());

        if (booking.status().isTerminal()) {
            throw new InvalidBookingStateException(booking.id(), booking.status(), booking.paymentStatus());
        }

        Receipt receipt = settlePaymentUseCase.release(
                ReleaseCommand.cancel(booking.id(), actor, command.reason()));

        Booking cancelled = load(booking.id());
        log.info("Booking cancelled: bookingId={}, cancelledBy={}, paymentStatus={}, refunded={}",
                cancelled.id(), actor, cancelled.paymentStatus(), receipt.amountRefunded());
        return new CancellationResult(cancelled, receipt.amountRefunded());
    }

    private Booking load(Long bookingId) {
        return bookingRepository.findById(bookingId)
                .orElseThrow(() -> new BookingNotFoundException(bookingId));
    }
}
