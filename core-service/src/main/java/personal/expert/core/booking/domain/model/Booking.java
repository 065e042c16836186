package personal.expert.core.booking.domain.model;

import lombok.Builder;
import personal.expert.common.exception.BusinessException;
import personal.expert.common.exception.ErrorCode;
import personal.expert.core.booking.domain.exception.BookingAccessDeniedException;
import personal.expert.core.booking.domain.exception.BookingAlreadyResolvedException;
import personal.expert.core.booking.domain.exception.InvalidBookingStateException;

import java.time.Duration;
import java.time.LocalDateTime;

/**
 * Booking Domain Model
 * 예약 도메인 모델 (불변)
 * <p>
 * 모든 상태 전이는 새 인스턴스를 반환하며, 저장 시 version 비교로 원자적으로 반영된다.
 * 생성자에서 예약 상태와 결제 상태의 조합 불변식을 검증한다.
 * <ul>
 *     <li>CAPTURED 결제는 CONFIRMED/COMPLETED 예약에만 존재</li>
 *     <li>DECLINED/CANCELLED 예약의 결제는 CANCELLED/REFUNDED/FAILED</li>
 * </ul>
 */
@Builder(toBuilder = true)
public record Booking(
        Long id,
        Long learnerId,
        Long expertId,
        Long slotId,
        Long sessionId,
        LocalDateTime startAt,
        LocalDateTime endAt,
        long amount,
        String currency,
        BookingStatus status,
        PaymentStatus paymentStatus,
        LocalDateTime heldUntil,
        String holdReference,
        long amountCaptured,
        long amountRefunded,
        BookingAction pendingAction,
        LocalDateTime actionClaimedAt,
        String learnerNotes,
        String expertNotes,
        String declineReason,
        String cancellationReason,
        CancelledBy cancelledBy,
        LocalDateTime createdAt,
        LocalDateTime updatedAt,
        Long version) {

    public Booking {
        if (learnerId == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Learner ID cannot be null");
        }
        if (expertId == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Expert ID cannot be null");
        }
        if (slotId == null || sessionId == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Slot and session cannot be null");
        }
        if (status == null || paymentStatus == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Booking status cannot be null");
        }
        if (heldUntil == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Hold expiry cannot be null");
        }
        if (paymentStatus == PaymentStatus.CAPTURED
                && status != BookingStatus.CONFIRMED && status != BookingStatus.COMPLETED) {
            throw new IllegalStateException(
                    String.format("Captured payment requires a confirmed booking. status=%s, bookingId=%d", status, id));
        }
        if ((status == BookingStatus.DECLINED || status == BookingStatus.CANCELLED) && !paymentStatus.isReleased()) {
            throw new IllegalStateException(
                    String.format("Terminated booking cannot keep payment %s. bookingId=%d", paymentStatus, id));
        }
        if (pendingAction != null && status.isTerminal()) {
            throw new IllegalStateException(
                    String.format("Terminal booking cannot hold a pending action. bookingId=%d", id));
        }
    }

    /**
     * 예약 생성 (정적 팩토리 메서드)
     * 금액/통화는 세션 가격에서 복사한다.
     *
     * @param learnerId 학습자 ID
     * @param slot      선점한 슬롯
     * @param session   슬롯이 속한 세션
     * @param notes     학습자 메모
     * @param now       기준 시각
     * @param holdGrace 결제 홀드 대기 시간
     * @return 새로운 예약 (PENDING / PENDING)
     */
    public static Booking reserve(Long learnerId, Slot slot, ExpertSession session, String notes,
                                  LocalDateTime now, Duration holdGrace) {
        return Booking.builder()
                .learnerId(learnerId)
                .expertId(slot.expertId())
                .slotId(slot.id())
                .sessionId(session.id())
                .startAt(slot.startAt())
                .endAt(slot.endAt())
                .amount(session.priceAmount())
                .currency(session.currency())
                .status(BookingStatus.PENDING)
                .paymentStatus(PaymentStatus.PENDING)
                .heldUntil(now.plus(holdGrace))
                .learnerNotes(notes)
                .createdAt(now)
                .updatedAt(now)
                .build();
    }

    // ========== 상태 조회 ==========

    /**
     * 결제 홀드 확인 대기 (PENDING / PENDING, 선점 없음)
     */
    public boolean isAwaitingHold() {
        return status == BookingStatus.PENDING && paymentStatus == PaymentStatus.PENDING && pendingAction == null;
    }

    /**
     * 전문가 승인 대기 (PENDING_APPROVAL / AUTHORIZED)
     */
    public boolean isAwaitingApproval() {
        return status == BookingStatus.PENDING_APPROVAL && paymentStatus == PaymentStatus.AUTHORIZED;
    }

    public boolean isCaptured() {
        return paymentStatus == PaymentStatus.CAPTURED;
    }

    public boolean isClaimed() {
        return pendingAction != null;
    }

    public boolean isClaimedBy(BookingAction action) {
        return pendingAction == action;
    }

    public boolean hasHold() {
        return holdReference != null;
    }

    public boolean isHoldExpired(LocalDateTime now) {
        return heldUntil.isBefore(now);
    }

    /**
     * 세션 종료 시각이 지난 확정 예약인지
     */
    public boolean isFinished(LocalDateTime now) {
        return status == BookingStatus.CONFIRMED && pendingAction == null && endAt.isBefore(now);
    }

    // ========== 접근 검증 (Tell, Don't Ask) ==========

    public void ensureLearner(Long actorId) {
        if (!learnerId.equals(actorId)) {
            throw new BookingAccessDeniedException(id, actorId);
        }
    }

    public void ensureExpert(Long actorId) {
        if (!expertId.equals(actorId)) {
            throw new BookingAccessDeniedException(id, actorId);
        }
    }

    public void ensureParticipant(Long actorId) {
        if (!learnerId.equals(actorId) && !expertId.equals(actorId)) {
            throw new BookingAccessDeniedException(id, actorId);
        }
    }

    /**
     * 취소 요청자의 역할 판별
     *
     * @throws BookingAccessDeniedException 예약 당사자가 아닌 경우
     */
    public CancelledBy cancellerOf(Long actorId) {
        if (learnerId.equals(actorId)) {
            return CancelledBy.LEARNER;
        }
        if (expertId.equals(actorId)) {
            return CancelledBy.EXPERT;
        }
        throw new BookingAccessDeniedException(id, actorId);
    }

    // ========== 결제 홀드 전이 ==========

    /**
     * 결제사 홀드 참조 저장 (상태 변경 없음)
     */
    public Booking attachHold(String reference, LocalDateTime now) {
        if (!isAwaitingHold()) {
            throw new InvalidBookingStateException(id, status, paymentStatus);
        }
        if (holdReference != null && !holdReference.equals(reference)) {
            throw new IllegalStateException(
                    String.format("Booking already holds %s, cannot attach %s. bookingId=%d", holdReference, reference, id));
        }
        return toBuilder().holdReference(reference).updatedAt(now).build();
    }

    /**
     * 홀드 확인 (PENDING -> PENDING_APPROVAL, 결제 PENDING -> AUTHORIZED)
     * 전문가 승인 기한만큼 held_until을 연장한다.
     */
    public Booking authorize(String reference, LocalDateTime now, Duration approvalWindow) {
        if (!isAwaitingHold()) {
            throw new InvalidBookingStateException(id, status, paymentStatus);
        }
        if (holdReference != null && reference != null && !holdReference.equals(reference)) {
            throw new IllegalStateException(
                    String.format("Hold reference mismatch: expected %s, got %s. bookingId=%d", holdReference, reference, id));
        }
        return toBuilder()
                .status(BookingStatus.PENDING_APPROVAL)
                .paymentStatus(PaymentStatus.AUTHORIZED)
                .holdReference(holdReference != null ? holdReference : reference)
                .heldUntil(now.plus(approvalWindow))
                .updatedAt(now)
                .build();
    }

    /**
     * 홀드 실패 (PENDING -> CANCELLED, 결제 PENDING -> FAILED)
     */
    public Booking failPayment(LocalDateTime now) {
        if (!isAwaitingHold()) {
            throw new InvalidBookingStateException(id, status, paymentStatus);
        }
        return toBuilder()
                .status(BookingStatus.CANCELLED)
                .paymentStatus(PaymentStatus.FAILED)
                .cancelledBy(CancelledBy.SYSTEM)
                .cancellationReason("payment failed")
                .updatedAt(now)
                .build();
    }

    // ========== 종결 액션 선점 ==========

    /**
     * 종결 액션 선점
     * 같은 액션의 재시도는 기존 선점을 그대로 이어받는다.
     *
     * @throws BookingAlreadyResolvedException 다른 액션이 먼저 선점했거나 이미 종결된 경우
     * @throws InvalidBookingStateException    액션을 수행할 수 없는 상태인 경우
     */
    public Booking claim(BookingAction action, CancelledBy actor, String reason, String notes, LocalDateTime now) {
        if (pendingAction == action) {
            return this;
        }
        if (pendingAction != null || status.isTerminal()) {
            throw new BookingAlreadyResolvedException(id, status, pendingAction);
        }

        switch (action) {
            case CONFIRM -> {
                ensureNotConfirmed();
                if (!isAwaitingApproval()) {
                    throw new InvalidBookingStateException(id, status, paymentStatus);
                }
            }
            case DECLINE -> {
                ensureNotConfirmed();
                if (status != BookingStatus.PENDING_APPROVAL) {
                    throw new InvalidBookingStateException(id, status, paymentStatus);
                }
            }
            case EXPIRE -> {
                ensureNotConfirmed();
                if (!isHoldExpired(now)) {
                    throw new InvalidBookingStateException(id, status, paymentStatus);
                }
            }
            case CANCEL -> {
                // 활성 상태(PENDING, PENDING_APPROVAL, CONFIRMED) 모두 취소 가능
            }
        }

        var builder = toBuilder()
                .pendingAction(action)
                .actionClaimedAt(now)
                .updatedAt(now);
        if (action == BookingAction.CONFIRM || action == BookingAction.DECLINE) {
            builder.expertNotes(notes != null ? notes : expertNotes);
        }
        if (action == BookingAction.DECLINE) {
            builder.declineReason(reason);
        }
        if (action == BookingAction.CANCEL || action == BookingAction.EXPIRE) {
            builder.cancelledBy(actor).cancellationReason(reason);
        }
        return builder.build();
    }

    /**
     * 선점 해제 (결제사 호출 실패 후 상태 유지)
     */
    public Booking abandonClaim(BookingAction action, LocalDateTime now) {
        if (pendingAction != action) {
            throw new IllegalStateException(
                    String.format("Booking is not claimed by %s. bookingId=%d, claim=%s", action, id, pendingAction));
        }
        return toBuilder().pendingAction(null).actionClaimedAt(null).updatedAt(now).build();
    }

    /**
     * 매입 완료 (PENDING_APPROVAL -> CONFIRMED, 결제 AUTHORIZED -> CAPTURED)
     */
    public Booking completeCapture(long captured, LocalDateTime now) {
        if (pendingAction != BookingAction.CONFIRM) {
            throw new IllegalStateException(
                    String.format("Capture requires a CONFIRM claim. bookingId=%d, claim=%s", id, pendingAction));
        }
        return captured(captured, now);
    }

    /**
     * 홀드 해제/환불 완료
     * DECLINE 선점은 DECLINED, CANCEL/EXPIRE 선점은 CANCELLED로 종결된다.
     */
    public Booking completeRelease(PaymentStatus result, long refunded, LocalDateTime now) {
        if (pendingAction == null || pendingAction == BookingAction.CONFIRM) {
            throw new IllegalStateException(
                    String.format("Release requires a terminating claim. bookingId=%d, claim=%s", id, pendingAction));
        }
        if (!result.isReleased()) {
            throw new IllegalStateException("Release cannot end with payment " + result);
        }
        return toBuilder()
                .status(pendingAction == BookingAction.DECLINE ? BookingStatus.DECLINED : BookingStatus.CANCELLED)
                .paymentStatus(result)
                .amountRefunded(refunded)
                .pendingAction(null)
                .actionClaimedAt(null)
                .updatedAt(now)
                .build();
    }

    // ========== 결제사 이벤트 기반 전이 ==========

    /**
     * 결제사에서 매입이 확인된 경우 적용 가능 여부
     * 승인 선점 중이거나 선점이 없을 때만 반영한다.
     */
    public boolean canApplyCaptureConfirmation() {
        return isAwaitingApproval() && (pendingAction == null || pendingAction == BookingAction.CONFIRM);
    }

    public Booking confirmCapture(long captured, LocalDateTime now) {
        if (!canApplyCaptureConfirmation()) {
            throw new InvalidBookingStateException(id, status, paymentStatus);
        }
        return captured(captured, now);
    }

    /**
     * 결제사에서 홀드가 취소된 경우 적용 가능 여부
     */
    public boolean canApplyHoldCancellation() {
        return pendingAction == null
                && (status == BookingStatus.PENDING || status == BookingStatus.PENDING_APPROVAL)
                && (paymentStatus == PaymentStatus.PENDING || paymentStatus == PaymentStatus.AUTHORIZED);
    }

    public Booking cancelByProcessor(LocalDateTime now) {
        if (!canApplyHoldCancellation()) {
            throw new InvalidBookingStateException(id, status, paymentStatus);
        }
        return toBuilder()
                .status(BookingStatus.CANCELLED)
                .paymentStatus(PaymentStatus.CANCELLED)
                .cancelledBy(CancelledBy.SYSTEM)
                .cancellationReason("payment hold cancelled by processor")
                .updatedAt(now)
                .build();
    }

    /**
     * 결제사에서 직접 환불된 경우 적용 가능 여부
     */
    public boolean canApplyExternalRefund() {
        return status == BookingStatus.CONFIRMED && isCaptured() && pendingAction == null;
    }

    public Booking refundByProcessor(long refunded, LocalDateTime now) {
        if (!canApplyExternalRefund()) {
            throw new InvalidBookingStateException(id, status, paymentStatus);
        }
        return toBuilder()
                .status(BookingStatus.CANCELLED)
                .paymentStatus(PaymentStatus.REFUNDED)
                .amountRefunded(refunded)
                .cancelledBy(CancelledBy.SYSTEM)
                .cancellationReason("refunded by processor")
                .updatedAt(now)
                .build();
    }

    /**
     * 세션 완료 (CONFIRMED -> COMPLETED)
     */
    public Booking complete(LocalDateTime now) {
        if (!isFinished(now)) {
            throw new InvalidBookingStateException(id, status, paymentStatus);
        }
        return toBuilder().status(BookingStatus.COMPLETED).updatedAt(now).build();
    }

    private Booking captured(long captured, LocalDateTime now) {
        return toBuilder()
                .status(BookingStatus.CONFIRMED)
                .paymentStatus(PaymentStatus.CAPTURED)
                .amountCaptured(captured)
                .pendingAction(null)
                .actionClaimedAt(null)
                .updatedAt(now)
                .build();
    }

    private void ensureNotConfirmed() {
        if (status == BookingStatus.CONFIRMED) {
            throw new BookingAlreadyResolvedException(id, status, pendingAction);
        }
    }
}
