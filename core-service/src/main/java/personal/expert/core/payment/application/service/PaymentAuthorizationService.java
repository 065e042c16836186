package personal.expert.core.payment.application.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import personal.expert.core.booking.application.port.out.BookingRepository;
import personal.expert.core.booking.domain.exception.BookingNotFoundException;
import personal.expert.core.booking.domain.exception.InvalidBookingStateException;
import personal.expert.core.booking.domain.model.Booking;
import personal.expert.core.booking.domain.service.BookingManager;
import personal.expert.core.payment.application.config.PaymentProperties;
import personal.expert.core.payment.application.port.in.AuthorizePaymentCommand;
import personal.expert.core.payment.application.port.in.AuthorizePaymentUseCase;
import personal.expert.core.payment.application.port.out.PaymentGateway;
import personal.expert.core.payment.domain.exception.ExternalProcessorException;
import personal.expert.core.payment.domain.exception.InvalidPaymentStateException;
import personal.expert.core.payment.domain.exception.PaymentAmountMismatchException;
import personal.expert.core.payment.domain.exception.UnsupportedCurrencyException;
import personal.expert.core.payment.domain.model.HoldRequest;
import personal.expert.core.payment.domain.model.IdempotencyKeys;
import personal.expert.core.payment.domain.model.PaymentHold;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Locale;

/**
 * Payment Authorization Service
 * <p>
 * 1. 예약/금액 검증
 * 2. 결제사 홀드 생성 (No Tx, 멱등 키 authorize-{bookingId})
 * 3. 홀드 참조 저장 (Tx). 결제사가 이미 승인한 홀드면 바로 PENDING_APPROVAL로 전이
 * <p>
 * 구매자 확정이 필요한 홀드는 Webhook(amount_capturable_updated)으로 승인이 반영된다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PaymentAuthorizationService implements AuthorizePaymentUseCase {

    private final BookingRepository bookingRepository;
    private final BookingManager bookingManager;
    private final PaymentGateway paymentGateway;
    private final PaymentProperties paymentProperties;
    private final Clock clock;

    @Override
    public PaymentHold authorize(AuthorizePaymentCommand command) {
        // 1. 검증
        Booking booking = bookingRepository.findById(command.bookingId())
                .orElseThrow(() -> new BookingNotFoundException(command.bookingId()));
        booking.ensureLearner(command.learnerId());

        if (!booking.isAwaitingHold()) {
            throw new InvalidPaymentStateException(booking.id(), booking.paymentStatus(), "authorize");
        }
        if (!paymentProperties.supports(command.currency())) {
            throw new UnsupportedCurrencyException(command.currency());
        }
        if (booking.amount() != command.amount()
                || !booking.currency().equals(command.currency().toLowerCase(Locale.ROOT))) {
            throw new PaymentAmountMismatchException(booking.id(), booking.amount(), booking.currency(),
                    command.amount(), command.currency());
        }

        // 2. 결제사 홀드 생성 (No Tx)
        PaymentHold hold;
        try {
            hold = paymentGateway.createHold(HoldRequest.of(booking.id(), booking.amount(), booking.currency()));
        } catch (ExternalProcessorException e) {
            log.error("Payment hold failed: bookingId={}", booking.id(), e);
            bookingManager.failPayment(booking.id(), now());
            throw e;
        }

        // 3. 홀드 참조 저장 (Tx)
        try {
            bookingManager.attachHold(booking.id(), hold.holdReference(), now());
        } catch (InvalidBookingStateException e) {
            // 홀드 생성 사이에 예약이 만료/취소된 경우
            log.warn("Booking left PENDING while hold was created, voiding hold: bookingId={}, holdReference={}",
                    booking.id(), hold.holdReference());
            voidStrayHold(booking.id(), hold.holdReference());
            throw new InvalidPaymentStateException(booking.id(), booking.paymentStatus(), "authorize");
        }

        if (hold.isAuthorized()) {
            bookingManager.authorizeHold(booking.id(), hold.holdReference(), now());
        }

        log.info("Payment hold created: bookingId={}, holdReference={}, status={}",
                booking.id(), hold.holdReference(), hold.status());
        return hold;
    }

    private void voidStrayHold(Long bookingId, String holdReference) {
        try {
            paymentGateway.cancelHold(holdReference, IdempotencyKeys.voidHold(bookingId, holdReference));
        } catch (ExternalProcessorException e) {
            log.error("Failed to void stray hold, manual follow-up required: bookingId={}, holdReference={}",
                    bookingId, holdReference, e);
        }
    }

    private LocalDateTime now() {
        return LocalDateTime.now(clock);
    }
}
