package personal.expert.core.booking.adapter.out.persistence;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import personal.expert.core.booking.domain.model.Booking;
import personal.expert.core.booking.domain.model.BookingAction;
import personal.expert.core.booking.domain.model.BookingStatus;
import personal.expert.core.booking.domain.model.CancelledBy;
import personal.expert.core.booking.domain.model.PaymentStatus;

import java.time.LocalDateTime;

/**
 * Booking JPA Entity
 * 예약 테이블 매핑. version 컬럼으로 상태 전이를 CAS로 반영한다.
 */
@Entity
@Table(name = "bookings",
        uniqueConstraints = @UniqueConstraint(
                name = "uk_hold_reference",
                columnNames = {"hold_reference"}
        ),
        indexes = {
                @Index(name = "idx_status_held_until", columnList = "status, held_until"),
                @Index(name = "idx_slot_learner", columnList = "slot_id, learner_id"),
                @Index(name = "idx_expert_status", columnList = "expert_id, status"),
                @Index(name = "idx_pending_action", columnList = "pending_action, action_claimed_at")
        })
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class BookingEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "learner_id", nullable = false)
    private Long learnerId;

    @Column(name = "expert_id", nullable = false)
    private Long expertId;

    @Column(name = "slot_id", nullable = false)
    private Long slotId;

    @Column(name = "session_id", nullable = false)
    private Long sessionId;

    @Column(name = "start_at", nullable = false)
    private LocalDateTime startAt;

    @Column(name = "end_at", nullable = false)
    private LocalDateTime endAt;

    @Column(nullable = false)
    private long amount;

    @Column(nullable = false, length = 3)
    private String currency;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private BookingStatus status;

    @Enumerated(EnumType.STRING)
    @Column(name = "payment_status", nullable = false, length = 20)
    private PaymentStatus paymentStatus;

    @Column(name = "held_until", nullable = false)
    private LocalDateTime heldUntil;

    @Column(name = "hold_reference", length = 100)
    private String holdReference;

    @Column(name = "amount_captured", nullable = false)
    private long amountCaptured;

    @Column(name = "amount_refunded", nullable = false)
    private long amountRefunded;

    @Enumerated(EnumType.STRING)
    @Column(name = "pending_action", length = 20)
    private BookingAction pendingAction;

    @Column(name = "action_claimed_at")
    private LocalDateTime actionClaimedAt;

    @Column(name = "learner_notes", length = 500)
    private String learnerNotes;

    @Column(name = "expert_notes", length = 500)
    private String expertNotes;

    @Column(name = "decline_reason", length = 500)
    private String declineReason;

    @Column(name = "cancellation_reason", length = 500)
    private String cancellationReason;

    @Enumerated(EnumType.STRING)
    @Column(name = "cancelled_by", length = 20)
    private CancelledBy cancelledBy;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    @Version
    private Long version;

    /**
     * 도메인 모델로부터 엔티티 생성
     */
    public static BookingEntity fromDomain(Booking booking) {
        BookingEntity entity = new BookingEntity();
        entity.id = booking.id();
        entity.learnerId = booking.learnerId();
        entity.expertId = booking.expertId();
        entity.slotId = booking.slotId();
        entity.sessionId = booking.sessionId();
        entity.startAt = booking.startAt();
        entity.endAt = booking.endAt();
        entity.amount = booking.amount();
        entity.currency = booking.currency();
        entity.status = booking.status();
        entity.paymentStatus = booking.paymentStatus();
        entity.heldUntil = booking.heldUntil();
        entity.holdReference = booking.holdReference();
        entity.amountCaptured = booking.amountCaptured();
        entity.amountRefunded = booking.amountRefunded();
        entity.pendingAction = booking.pendingAction();
        entity.actionClaimedAt = booking.actionClaimedAt();
        entity.learnerNotes = booking.learnerNotes();
        entity.expertNotes = booking.expertNotes();
        entity.declineReason = booking.declineReason();
        entity.cancellationReason = booking.cancellationReason();
        entity.cancelledBy = booking.cancelledBy();
        entity.createdAt = booking.createdAt();
        entity.updatedAt = booking.updatedAt();
        entity.version = booking.version();
        return entity;
    }

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = LocalDateTime.now();
        }
        if (updatedAt == null) {
            updatedAt = createdAt;
        }
    }

    /**
     * 도메인 모델로 변환
     */
    public Booking toDomain() {
        return new Booking(id, learnerId, expertId, slotId, sessionId, startAt, endAt, amount, currency,
                status, paymentStatus, heldUntil, holdReference, amountCaptured, amountRefunded,
                pendingAction, actionClaimedAt, learnerNotes, expertNotes, declineReason, cancellationReason,
                cancelledBy, createdAt, updatedAt, version);
    }
}
