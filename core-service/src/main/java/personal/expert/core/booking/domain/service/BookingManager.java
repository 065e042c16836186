package personal.expert.core.booking.domain.service;

import io.github.resilience4j.retry.annotation.Retry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;
import personal.expert.core.booking.application.config.BookingProperties;
import personal.expert.core.booking.application.port.in.ReserveSlotCommand;
import personal.expert.core.booking.application.port.out.BookingEventPort;
import personal.expert.core.booking.application.port.out.BookingRepository;
import personal.expert.core.booking.application.port.out.ExpertSessionRepository;
import personal.expert.core.booking.application.port.out.SlotRepository;
import personal.expert.core.booking.domain.exception.BookingNotFoundException;
import personal.expert.core.booking.domain.exception.DuplicateBookingException;
import personal.expert.core.booking.domain.exception.SessionNotFoundException;
import personal.expert.core.booking.domain.exception.SlotNotBookableException;
import personal.expert.core.booking.domain.exception.SlotNotFoundException;
import personal.expert.core.booking.domain.exception.SlotUnavailableException;
import personal.expert.core.booking.domain.model.Booking;
import personal.expert.core.booking.domain.model.BookingAction;
import personal.expert.core.booking.domain.model.CancelledBy;
import personal.expert.core.booking.domain.model.ExpertSession;
import personal.expert.core.booking.domain.model.PaymentStatus;
import personal.expert.core.booking.domain.model.Slot;

import java.time.LocalDateTime;

/**
 * Booking Domain Service (Transaction Manager)
 * 트랜잭션 범위 분리를 위한 실행 전용 서비스
 * <p>
 * Safe Transaction Pattern: 결제사 호출은 이 클래스 밖에서 수행하고,
 * 여기서는 예약/슬롯 상태 변경만 짧은 트랜잭션으로 처리한다.
 * 예약 저장은 version 비교(CAS)로 반영되며, 충돌 시 bookingTransaction Retry가
 * 새 트랜잭션에서 다시 읽고 판단한다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class BookingManager {

    private static final String RETRY_NAME = "bookingTransaction";

    private final BookingRepository bookingRepository;
    private final SlotRepository slotRepository;
    private final ExpertSessionRepository expertSessionRepository;
    private final BookingEventPort bookingEventPort;
    private final BookingProperties bookingProperties;

    /**
     * 슬롯 선점 및 예약 생성
     * 잔여 수량 차감은 조건부 UPDATE 한 번으로 수행되어, 동시에 들어온 요청 중
     * 수량만큼만 성공한다. 이후 예약 INSERT가 실패하면 차감도 함께 롤백된다.
     */
    @Retry(name = RETRY_NAME)
    @Transactional
    public Booking reserveInTransaction(ReserveSlotCommand command, LocalDateTime now) {
        // 1. 슬롯/세션 조회 및 검증
        Slot slot = slotRepository.findById(command.slotId())
                .orElseThrow(() -> new SlotNotFoundException(command.slotId()));
        if (!slot.belongsTo(command.sessionId())) {
            throw new SlotNotBookableException(slot.id(), "slot does not belong to session " + command.sessionId());
        }
        ExpertSession session = expertSessionRepository.findById(slot.sessionId())
                .orElseThrow(() -> new SessionNotFoundException(slot.sessionId()));

        var reservation = bookingProperties.reservation();
        slot.ensureBookableAt(now, reservation.minLeadTime(), reservation.maxAdvance());

        // 2. 동일 학습자 중복 예약 방지
        if (bookingRepository.existsActiveBooking(slot.id(), command.learnerId())) {
            throw new DuplicateBookingException(slot.id(), command.learnerId());
        }

        // 3. 원자적 수량 차감 (remaining > 0 조건)
        if (!slotRepository.claimCapacity(slot.id())) {
            log.warn("Slot claim lost: slotId={}, learnerId={}", slot.id(), command.learnerId());
            throw new SlotUnavailableException(slot.id());
        }

        // 4. 예약 생성 (PENDING / PENDING)
        Booking booking = Booking.reserve(
                command.learnerId(), slot, session, command.notes(), now, reservation.holdGrace());
        Booking saved = bookingRepository.save(booking);
        bookingEventPort.publishStatusChanged(saved);
        return saved;
    }

    /**
     * 종결 액션 선점
     * 같은 액션이 이미 선점되어 있으면 저장 없이 그대로 반환한다.
     */
    @Retry(name = RETRY_NAME)
    @Transactional
    public Booking claim(Long bookingId, BookingAction action, CancelledBy actor, String reason, String notes,
                         LocalDateTime now) {
        Booking booking = load(bookingId);
        Booking claimed = booking.claim(action, actor, reason, notes, now);
        if (claimed == booking) {
            log.info("Resuming existing claim: bookingId={}, action={}", bookingId, action);
            return booking;
        }

        Booking saved = bookingRepository.save(claimed);
        log.info("Booking claimed: bookingId={}, action={}, status={}", bookingId, action, saved.status());
        return saved;
    }

    @Retry(name = RETRY_NAME)
    @Transactional
    public Booking abandonClaim(Long bookingId, BookingAction action, LocalDateTime now) {
        Booking booking = load(bookingId);
        if (!booking.isClaimedBy(action)) {
            log.warn("Claim already gone: bookingId={}, action={}, current={}", bookingId, action, booking.pendingAction());
            return booking;
        }
        return bookingRepository.save(booking.abandonClaim(action, now));
    }

    /**
     * 매입 완료 반영 (CONFIRM 선점 -> CONFIRMED / CAPTURED)
     */
    @Retry(name = RETRY_NAME)
    @Transactional
    public Booking completeCapture(Long bookingId, long amountCaptured, LocalDateTime now) {
        Booking booking = load(bookingId);
        if (!booking.isClaimedBy(BookingAction.CONFIRM)) {
            // Webhook이 먼저 매입을 반영한 경우
            log.warn("Capture already settled: bookingId={}, status={}, paymentStatus={}",
                    bookingId, booking.status(), booking.paymentStatus());
            return booking;
        }

        Booking saved = bookingRepository.save(booking.completeCapture(amountCaptured, now));
        bookingEventPort.publishStatusChanged(saved);
        return saved;
    }

    /**
     * 홀드 해제/환불 완료 반영 및 슬롯 수량 반환
     */
    @Retry(name = RETRY_NAME)
    @Transactional
    public Booking completeRelease(Long bookingId, BookingAction action, PaymentStatus result, long refunded,
                                   LocalDateTime now) {
        Booking booking = load(bookingId);
        if (!booking.isClaimedBy(action)) {
            log.warn("Release already settled: bookingId={}, action={}, status={}", bookingId, action, booking.status());
            return booking;
        }

        Booking saved = bookingRepository.save(booking.completeRelease(result, refunded, now));
        releaseSlot(saved);
        bookingEventPort.publishStatusChanged(saved);
        return saved;
    }

    /**
     * 결제사 홀드 참조 저장
     * 같은 참조가 이미 저장된 경우(재시도) 그대로 반환한다.
     */
    @Retry(name = RETRY_NAME)
    @Transactional
    public Booking attachHold(Long bookingId, String holdReference, LocalDateTime now) {
        Booking booking = load(bookingId);
        if (holdReference.equals(booking.holdReference())) {
            return booking;
        }
        return bookingRepository.save(booking.attachHold(holdReference, now));
    }

    /**
     * 홀드 확인 반영 (PENDING_APPROVAL / AUTHORIZED)
     */
    @Retry(name = RETRY_NAME)
    @Transactional
    public Booking authorizeHold(Long bookingId, String holdReference, LocalDateTime now) {
        Booking booking = load(bookingId);
        if (booking.isAwaitingApproval() && holdReference.equals(booking.holdReference())) {
            return booking;
        }

        Booking saved = bookingRepository.save(
                booking.authorize(holdReference, now, bookingProperties.approval().window()));
        bookingEventPort.publishStatusChanged(saved);
        log.info("Payment hold authorized: bookingId={}, heldUntil={}", bookingId, saved.heldUntil());
        return saved;
    }

    /**
     * 홀드 실패 반영 (CANCELLED / FAILED) 및 슬롯 수량 반환
     */
    @Retry(name = RETRY_NAME)
    @Transactional
    public Booking failPayment(Long bookingId, LocalDateTime now) {
        Booking booking = load(bookingId);
        if (!booking.isAwaitingHold()) {
            log.warn("Booking no longer awaiting hold, skip failure: bookingId={}, status={}, paymentStatus={}",
                    bookingId, booking.status(), booking.paymentStatus());
            return booking;
        }

        Booking saved = bookingRepository.save(booking.failPayment(now));
        releaseSlot(saved);
        bookingEventPort.publishStatusChanged(saved);
        return saved;
    }

    /**
     * 세션 종료된 확정 예약 완료 처리 (슬롯 수량은 영구 소진)
     */
    @Retry(name = RETRY_NAME)
    @Transactional
    public Booking complete(Long bookingId, LocalDateTime now) {
        Booking booking = load(bookingId);
        if (!booking.isFinished(now)) {
            log.warn("Booking not finished, skip completion: bookingId={}, status={}", bookingId, booking.status());
            return booking;
        }

        Booking saved = bookingRepository.save(booking.complete(now));
        bookingEventPort.publishStatusChanged(saved);
        return saved;
    }

    private Booking load(Long bookingId) {
        return bookingRepository.findById(bookingId)
                .orElseThrow(() -> new BookingNotFoundException(bookingId));
    }

    private void releaseSlot(Booking booking) {
        if (slotRepository.releaseCapacity(booking.slotId())) {
            log.info("Slot capacity released: slotId={}, bookingId={}", booking.slotId(), booking.id());
        } else {
            log.warn("Slot capacity already at maximum: slotId={}, bookingId={}", booking.slotId(), booking.id());
        }
    }
}
