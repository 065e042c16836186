package personal.expert.core.booking.adapter.out.persistence;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Spring Data JPA Repository for Slot
 */
public interface JpaSlotRepository extends JpaRepository<SlotEntity, Long> {

    /**
     * 조건부 수량 차감. 행 잠금 해제 후 조건을 다시 평가하므로 동시 요청 중 잔여 수량만큼만 1을 반환한다.
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE SlotEntity s SET s.remainingCapacity = s.remainingCapacity - 1 " +
            "WHERE s.id = :slotId AND s.remainingCapacity > 0 AND s.available = true")
    int decrementRemaining(@Param("slotId") Long slotId);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE SlotEntity s SET s.remainingCapacity = s.remainingCapacity + 1 " +
            "WHERE s.id = :slotId AND s.remainingCapacity < s.capacity")
    int incrementRemaining(@Param("slotId") Long slotId);

    @Query("SELECT s FROM SlotEntity s " +
            "WHERE s.sessionId = :sessionId AND s.available = true AND s.remainingCapacity > 0 " +
            "AND s.startAt >= :from AND s.startAt <= :to " +
            "ORDER BY s.startAt ASC")
    List<SlotEntity> findOffered(@Param("sessionId") Long sessionId,
                                 @Param("from") LocalDateTime from,
                                 @Param("to") LocalDateTime to);
}
