package personal.expert.core.booking.domain.model;

import personal.expert.common.exception.BusinessException;
import personal.expert.common.exception.ErrorCode;
import personal.expert.core.booking.domain.exception.SlotNotBookableException;

import java.time.Duration;
import java.time.LocalDateTime;

/**
 * Slot Domain Model
 * 전문가의 예약 가능 시간대 (불변)
 * remainingCapacity는 Reservation Guard의 조건부 UPDATE로만 변경된다.
 */
public record Slot(
        Long id,
        Long expertId,
        Long sessionId,
        LocalDateTime startAt,
        LocalDateTime endAt,
        int capacity,
        int remainingCapacity,
        boolean available) {

    public Slot {
        if (expertId == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Expert ID cannot be null");
        }
        if (sessionId == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Session ID cannot be null");
        }
        if (startAt == null || endAt == null || !endAt.isAfter(startAt)) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Slot time range is invalid");
        }
        if (capacity < 1) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Slot capacity must be positive");
        }
        if (remainingCapacity < 0 || remainingCapacity > capacity) {
            throw new BusinessException(ErrorCode.INVALID_INPUT,
                    String.format("Remaining capacity out of range: %d/%d", remainingCapacity, capacity));
        }
    }

    public static Slot open(Long expertId, Long sessionId, LocalDateTime startAt, LocalDateTime endAt, int capacity) {
        return new Slot(null, expertId, sessionId, startAt, endAt, capacity, capacity, true);
    }

    public boolean belongsTo(Long requestedSessionId) {
        return sessionId.equals(requestedSessionId);
    }

    /**
     * 예약 가능 시간 범위 검증
     * 시작 시각이 [now + minLeadTime, now + maxAdvance] 안에 있어야 한다.
     *
     * @throws SlotNotBookableException 범위를 벗어난 경우
     */
    public void ensureBookableAt(LocalDateTime now, Duration minLeadTime, Duration maxAdvance) {
        if (startAt.isBefore(now.plus(minLeadTime))) {
            throw new SlotNotBookableException(id,
                    String.format("starts at %s, earlier than minimum lead time %s", startAt, minLeadTime));
        }
        if (startAt.isAfter(now.plus(maxAdvance))) {
            throw new SlotNotBookableException(id,
                    String.format("starts at %s, beyond maximum advance %s", startAt, maxAdvance));
        }
    }
}
