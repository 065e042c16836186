package personal.expert.core.payment.domain.service;

import io.github.resilience4j.retry.annotation.Retry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;
import personal.expert.core.booking.application.config.BookingProperties;
import personal.expert.core.booking.application.port.out.BookingEventPort;
import personal.expert.core.booking.application.port.out.BookingRepository;
import personal.expert.core.booking.application.port.out.SlotRepository;
import personal.expert.core.booking.domain.model.Booking;
import personal.expert.core.payment.application.port.out.WebhookEventRepository;
import personal.expert.core.payment.domain.model.PaymentEvent;
import personal.expert.core.payment.domain.model.PaymentEventType;
import personal.expert.core.payment.domain.model.WebhookApplication;
import personal.expert.core.payment.domain.model.WebhookEvent;
import personal.expert.core.payment.domain.model.WebhookOutcome;

import java.time.LocalDateTime;
import java.util.Objects;
import java.util.Optional;

/**
 * Payment Event Manager (Transaction Manager)
 * 결제사 이벤트의 상태 반영과 원장 기록을 하나의 트랜잭션으로 처리한다.
 * <p>
 * 원장 INSERT는 event_id 유니크 제약으로 보호되어, 같은 이벤트가 동시에 들어오면
 * 한 트랜잭션만 커밋되고 나머지는 DataIntegrityViolationException으로 롤백된다.
 * 적용 불가능한 이벤트(순서 역전, 이미 종결된 예약)는 DISCARDED로 기록만 남긴다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PaymentEventManager {

    private final BookingRepository bookingRepository;
    private final SlotRepository slotRepository;
    private final WebhookEventRepository webhookEventRepository;
    private final BookingEventPort bookingEventPort;
    private final BookingProperties bookingProperties;

    @Retry(name = "bookingTransaction")
    @Transactional
    public WebhookApplication apply(PaymentEvent event, LocalDateTime now) {
        if (webhookEventRepository.existsByEventId(event.eventId())) {
            return WebhookApplication.duplicated();
        }
        if (event.type() == PaymentEventType.UNHANDLED) {
            log.debug("Ignoring webhook event: eventId={}, type={}", event.eventId(), event.rawType());
            return record(event, event.bookingId(), WebhookOutcome.IGNORED, null, now);
        }

        Optional<Booking> found = findBooking(event);
        if (found.isEmpty()) {
            log.warn("Webhook event for unknown booking: eventId={}, type={}, bookingId={}, holdReference={}",
                    event.eventId(), event.rawType(), event.bookingId(), event.holdReference());
            return record(event, event.bookingId(), WebhookOutcome.FAILED, "booking not found", now);
        }

        Booking booking = found.get();
        return switch (event.type()) {
            case HOLD_SUCCEEDED -> onHoldSucceeded(event, booking, now);
            case HOLD_FAILED -> onHoldFailed(event, booking, now);
            case HOLD_CANCELED -> onHoldCanceled(event, booking, now);
            case CAPTURE_CONFIRMED -> onCaptureConfirmed(event, booking, now);
            case REFUNDED -> onRefunded(event, booking, now);
            case UNHANDLED -> record(event, booking.id(), WebhookOutcome.IGNORED, null, now);
        };
    }

    /**
     * 처리 실패 기록 (상태 반영 트랜잭션이 롤백된 뒤 별도 트랜잭션)
     */
    @Transactional
    public WebhookApplication recordFailure(PaymentEvent event, String errorMessage, LocalDateTime now) {
        return record(event, event.bookingId(), WebhookOutcome.FAILED, errorMessage, now);
    }

    private WebhookApplication onHoldSucceeded(PaymentEvent event, Booking booking, LocalDateTime now) {
        boolean sameHold = booking.holdReference() == null || event.holdReference() == null
                || booking.holdReference().equals(event.holdReference());

        if (booking.isAwaitingHold() && sameHold) {
            Booking authorized = booking.authorize(event.holdReference(), now, bookingProperties.approval().window());
            saveAndPublish(authorized);
            log.info("Hold authorized by processor: bookingId={}, heldUntil={}", booking.id(), authorized.heldUntil());
            return record(event, booking.id(), WebhookOutcome.APPLIED, null, now);
        }

        // 종결된 예약(또는 다른 홀드)에 승인된 홀드는 해제 대상
        if (event.holdReference() != null && !booking.isCaptured()
                && (booking.status().isTerminal() || !sameHold)) {
            log.warn("Hold authorized for released booking, scheduling void: bookingId={}, status={}, holdReference={}",
                    booking.id(), booking.status(), event.holdReference());
            append(event, booking.id(), WebhookOutcome.DISCARDED, "booking already " + booking.status(), now);
            return WebhookApplication.strayHold(booking.id(), event.holdReference());
        }

        return discard(event, booking, now);
    }

    private WebhookApplication onHoldFailed(PaymentEvent event, Booking booking, LocalDateTime now) {
        if (!booking.isAwaitingHold()) {
            return discard(event, booking, now);
        }
        Booking failed = booking.failPayment(now);
        saveAndPublish(failed);
        releaseSlot(failed);
        log.info("Hold failed at processor: bookingId={}", booking.id());
        return record(event, booking.id(), WebhookOutcome.APPLIED, null, now);
    }

    private WebhookApplication onHoldCanceled(PaymentEvent event, Booking booking, LocalDateTime now) {
        if (!booking.canApplyHoldCancellation()) {
            return discard(event, booking, now);
        }
        Booking cancelled = booking.cancelByProcessor(now);
        saveAndPublish(cancelled);
        releaseSlot(cancelled);
        log.info("Hold cancelled by processor: bookingId={}", booking.id());
        return record(event, booking.id(), WebhookOutcome.APPLIED, null, now);
    }

    private WebhookApplication onCaptureConfirmed(PaymentEvent event, Booking booking, LocalDateTime now) {
        if (!booking.canApplyCaptureConfirmation()) {
            return discard(event, booking, now);
        }
        long captured = Objects.requireNonNullElse(event.amount(), booking.amount());
        saveAndPublish(booking.confirmCapture(captured, now));
        log.info("Capture confirmed by processor: bookingId={}, amount={}", booking.id(), captured);
        return record(event, booking.id(), WebhookOutcome.APPLIED, null, now);
    }

    private WebhookApplication onRefunded(PaymentEvent event, Booking booking, LocalDateTime now) {
        if (!booking.canApplyExternalRefund()) {
            return discard(event, booking, now);
        }
        long refunded = Objects.requireNonNullElse(event.amount(), booking.amountCaptured());
        Booking cancelled = booking.refundByProcessor(refunded, now);
        saveAndPublish(cancelled);
        releaseSlot(cancelled);
        log.info("Refund issued at processor: bookingId={}, amount={}", booking.id(), refunded);
        return record(event, booking.id(), WebhookOutcome.APPLIED, null, now);
    }

    private Optional<Booking> findBooking(PaymentEvent event) {
        if (event.bookingId() != null) {
            Optional<Booking> byId = bookingRepository.findById(event.bookingId());
            if (byId.isPresent()) {
                return byId;
            }
        }
        if (event.holdReference() != null) {
            return bookingRepository.findByHoldReference(event.holdReference());
        }
        return Optional.empty();
    }

    private WebhookApplication discard(PaymentEvent event, Booking booking, LocalDateTime now) {
        log.info("Discarding out-of-order webhook: eventId={}, type={}, bookingId={}, status={}, paymentStatus={}",
                event.eventId(), event.rawType(), booking.id(), booking.status(), booking.paymentStatus());
        return record(event, booking.id(), WebhookOutcome.DISCARDED,
                "not applicable in " + booking.status() + "/" + booking.paymentStatus(), now);
    }

    private WebhookApplication record(PaymentEvent event, Long bookingId, WebhookOutcome outcome,
                                      String errorMessage, LocalDateTime now) {
        append(event, bookingId, outcome, errorMessage, now);
        return WebhookApplication.of(outcome, bookingId);
    }

    private void append(PaymentEvent event, Long bookingId, WebhookOutcome outcome,
                        String errorMessage, LocalDateTime now) {
        webhookEventRepository.append(WebhookEvent.record(event, bookingId, outcome, errorMessage, now));
    }

    private void saveAndPublish(Booking booking) {
        Booking saved = bookingRepository.save(booking);
        bookingEventPort.publishStatusChanged(saved);
    }

    private void releaseSlot(Booking booking) {
        if (!slotRepository.releaseCapacity(booking.slotId())) {
            log.warn("Slot capacity already at maximum: slotId={}, bookingId={}", booking.slotId(), booking.id());
        }
    }
}
