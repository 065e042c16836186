package personal.expert.core.payment.application.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import personal.expert.core.booking.application.config.BookingProperties;
import personal.expert.core.booking.application.port.out.BookingRepository;
import personal.expert.core.booking.domain.exception.BookingAlreadyResolvedException;
import personal.expert.core.booking.domain.exception.BookingNotFoundException;
import personal.expert.core.booking.domain.model.Booking;
import personal.expert.core.booking.domain.model.BookingAction;
import personal.expert.core.booking.domain.model.CancelledBy;
import personal.expert.core.booking.domain.model.PaymentStatus;
import personal.expert.core.booking.domain.service.BookingManager;
import personal.expert.core.payment.application.port.in.CaptureCommand;
import personal.expert.core.payment.application.port.in.ReleaseCommand;
import personal.expert.core.payment.application.port.in.SettlePaymentUseCase;
import personal.expert.core.payment.application.port.out.PaymentGateway;
import personal.expert.core.payment.domain.exception.ExternalProcessorException;
import personal.expert.core.payment.domain.exception.InvalidPaymentStateException;
import personal.expert.core.payment.domain.exception.PaymentAmountMismatchException;
import personal.expert.core.payment.domain.model.CaptureResult;
import personal.expert.core.payment.domain.model.HoldCancellation;
import personal.expert.core.payment.domain.model.IdempotencyKeys;
import personal.expert.core.payment.domain.model.Receipt;

import java.time.Clock;
import java.time.LocalDateTime;

/**
 * Payment Settlement Service (Payment Orchestrator)
 * <p>
 * 모든 종결 연산은 같은 순서로 진행된다.
 * 1. 선점 (Tx)  : 예약에 pending_action 기록. 다른 액션이 먼저 선점했으면 409
 * 2. 결제사 호출 (No Tx) : 예약 ID 기반 멱등 키 사용
 * 3. 반영 (Tx)  : 예약 상태 + 결제 상태 + 슬롯 수량을 함께 변경하고 선점 해제
 * <p>
 * 2단계 이후 3단계 전에 중단되면 선점이 남고, sweep이 claimTimeout 이후 같은 멱등 키로 이어서 처리한다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PaymentSettlementService implements SettlePaymentUseCase {

    private final BookingRepository bookingRepository;
    private final BookingManager bookingManager;
    private final PaymentGateway paymentGateway;
    private final BookingProperties bookingProperties;
    private final Clock clock;

    @Override
    public Receipt capture(CaptureCommand command) {
        Long bookingId = command.bookingId();
        Booking booking = load(bookingId);
        if (booking.isCaptured()) {
            log.info("Capture skipped, already captured: bookingId={}", bookingId);
            return Receipt.from(booking);
        }
        if (command.amountToCapture() != null && command.amountToCapture() > booking.amount()) {
            throw new PaymentAmountMismatchException(bookingId, booking.amount(), booking.currency(),
                    command.amountToCapture(), booking.currency());
        }

        Booking claimed;
        try {
            claimed = bookingManager.claim(bookingId, BookingAction.CONFIRM, null, null, command.notes(), now());
        } catch (BookingAlreadyResolvedException e) {
            // 선점 직전에 다른 요청이 매입을 끝낸 경우는 성공으로 본다
            Booking current = load(bookingId);
            if (current.isCaptured()) {
                return Receipt.from(current);
            }
            throw e;
        }
        return settleCapture(claimed, command.amountToCapture());
    }

    @Override
    public Receipt cancelHold(ReleaseCommand command) {
        Booking booking = load(command.bookingId());
        if (booking.isCaptured()) {
            throw new InvalidPaymentStateException(booking.id(), booking.paymentStatus(), "cancel hold of");
        }
        return release(command);
    }

    @Override
    public Receipt refund(ReleaseCommand command) {
        Booking booking = load(command.bookingId());
        if (!booking.isCaptured() && !booking.isClaimedBy(command.action())) {
            throw new InvalidPaymentStateException(booking.id(), booking.paymentStatus(), "refund");
        }
        return release(command);
    }

    @Override
    public Receipt release(ReleaseCommand command) {
        LocalDateTime now = command.requestedAt() != null ? command.requestedAt() : now();
        Booking booking = load(command.bookingId());

        // 환불 가능 시간이 지났으면 선점 전에 거부 (선점 후 실패하면 예약이 묶인다)
        if (booking.isCaptured() && !booking.isClaimedBy(command.action())) {
            bookingProperties.cancellation().toPolicy().refundableAmount(booking, command.actor(), now);
        }

        Booking claimed = bookingManager.claim(
                command.bookingId(), command.action(), command.actor(), command.reason(), command.notes(), now);
        return settleRelease(claimed);
    }

    @Override
    public Receipt resume(Long bookingId, LocalDateTime now) {
        Booking booking = load(bookingId);
        if (!booking.isClaimed()) {
            log.info("Nothing to resume: bookingId={}, status={}", bookingId, booking.status());
            return Receipt.from(booking);
        }
        if (booking.isClaimedBy(BookingAction.CONFIRM)) {
            return settleCapture(booking, null);
        }
        return settleRelease(booking);
    }

    private Receipt settleCapture(Booking claimed, Long amountToCapture) {
        Long bookingId = claimed.id();
        try {
            CaptureResult result = paymentGateway.capture(
                    claimed.holdReference(), amountToCapture, IdempotencyKeys.capture(bookingId));

            Booking confirmed = bookingManager.completeCapture(bookingId, result.amountCaptured(), now());
            log.info("Payment captured: bookingId={}, amount={} {}", bookingId, result.amountCaptured(), claimed.currency());
            return Receipt.from(confirmed);

        } catch (ExternalProcessorException e) {
            log.error("Capture failed, releasing claim: bookingId={}, holdReference={}",
                    bookingId, claimed.holdReference(), e);
            bookingManager.abandonClaim(bookingId, BookingAction.CONFIRM, now());
            throw e;
        }
    }

    private Receipt settleRelease(Booking claimed) {
        Long bookingId = claimed.id();
        BookingAction action = claimed.pendingAction();
        PaymentStatus result;
        long refunded = 0L;

        try {
            if (claimed.isCaptured()) {
                CancelledBy actor = action == BookingAction.DECLINE ? CancelledBy.EXPERT : claimed.cancelledBy();
                long refundable = bookingProperties.cancellation().toPolicy()
                        .refundableAmount(claimed, actor, claimed.actionClaimedAt());
                refunded = refund(claimed, refundable);
                result = PaymentStatus.REFUNDED;

            } else if (claimed.hasHold()) {
                HoldCancellation cancellation = paymentGateway.cancelHold(
                        claimed.holdReference(), IdempotencyKeys.cancel(bookingId));
                if (cancellation.alreadyCaptured()) {
                    // 해제 요청 전에 결제사에서 이미 매입된 경우 전액 환불
                    log.warn("Hold was already captured, refunding instead: bookingId={}", bookingId);
                    refunded = refund(claimed, cancellation.amountCaptured());
                    result = PaymentStatus.REFUNDED;
                } else {
                    result = PaymentStatus.CANCELLED;
                }

            } else {
                // 결제사 홀드가 생성되지 않은 예약
                result = PaymentStatus.CANCELLED;
            }

        } catch (ExternalProcessorException e) {
            log.error("Release failed, claim kept for retry: bookingId={}, action={}", bookingId, action, e);
            throw e;
        }

        Booking settled = bookingManager.completeRelease(bookingId, action, result, refunded, now());
        log.info("Booking released: bookingId={}, action={}, status={}, paymentStatus={}, refunded={}",
                bookingId, action, settled.status(), settled.paymentStatus(), refunded);
        return Receipt.from(settled);
    }

    private long refund(Booking booking, long amount) {
        if (amount <= 0) {
            log.info("No refundable amount: bookingId={}", booking.id());
            return 0L;
        }
        return paymentGateway.refund(booking.holdReference(), amount, IdempotencyKeys.refund(booking.id()))
                .amountRefunded();
    }

    private Booking load(Long bookingId) {
        return bookingRepository.findById(bookingId)
                .orElseThrow(() -> new BookingNotFoundException(bookingId));
    }

    private LocalDateTime now() {
        return LocalDateTime.now(clock);
    }
}
