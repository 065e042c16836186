package personal.expert.core.booking.adapter.out.persistence;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import personal.expert.core.booking.domain.model.Slot;

import java.time.LocalDateTime;

/**
 * Slot JPA Entity
 * 슬롯 테이블 매핑
 */
@Entity
@Table(name = "slots",
        indexes = {
                @Index(name = "idx_session_start", columnList = "session_id, start_at"),
                @Index(name = "idx_expert_start", columnList = "expert_id, start_at")
        })
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class SlotEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "expert_id", nullable = false)
    private Long expertId;

    @Column(name = "session_id", nullable = false)
    private Long sessionId;

    @Column(name = "start_at", nullable = false)
    private LocalDateTime startAt;

    @Column(name = "end_at", nullable = false)
    private LocalDateTime endAt;

    @Column(nullable = false)
    private int capacity;

    @Column(name = "remaining_capacity", nullable = false)
    private int remainingCapacity;

    @Column(nullable = false)
    private boolean available;

    public static SlotEntity fromDomain(Slot slot) {
        SlotEntity entity = new SlotEntity();
        entity.id = slot.id();
        entity.expertId = slot.expertId();
        entity.sessionId = slot.sessionId();
        entity.startAt = slot.startAt();
        entity.endAt = slot.endAt();
        entity.capacity = slot.capacity();
        entity.remainingCapacity = slot.remainingCapacity();
        entity.available = slot.available();
        return entity;
    }

    public Slot toDomain() {
        return new Slot(id, expertId, sessionId, startAt, endAt, capacity, remainingCapacity, available);
    }
}
