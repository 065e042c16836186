package personal.expert.core.booking.application.port.out;

import personal.expert.core.booking.domain.model.Slot;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Slot Repository Port
 * 잔여 수량은 claimCapacity / releaseCapacity의 조건부 UPDATE로만 변경한다.
 */
public interface SlotRepository {

    Slot save(Slot slot);

    Optional<Slot> findById(Long slotId);

    /**
     * 잔여 수량이 있고 공개된 슬롯의 수량을 1 차감
     *
     * @return 차감 성공 여부 (경쟁에서 진 경우 false)
     */
    boolean claimCapacity(Long slotId);

    /**
     * 수량 1 반환 (총 수량을 넘지 않음)
     *
     * @return 반환 성공 여부
     */
    boolean releaseCapacity(Long slotId);

    List<Slot> findOfferedSlots(Long sessionId, LocalDateTime from, LocalDateTime to);
}
