package personal.expert.core.booking.adapter.out.persistence;

import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import personal.expert.core.booking.domain.model.BookingStatus;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Spring Data JPA Repository for Booking
 */
public interface JpaBookingRepository extends JpaRepository<BookingEntity, Long> {

    Optional<BookingEntity> findByHoldReference(String holdReference);

    boolean existsBySlotIdAndLearnerIdAndStatusIn(Long slotId, Long learnerId, Collection<BookingStatus> statuses);

    List<BookingEntity> findByExpertIdAndStatusOrderByHeldUntilAsc(Long expertId, BookingStatus status);

    /**
     * held_until이 지났고 선점되지 않은 예약 (오래된 순)
     */
    @Query("SELECT b FROM BookingEntity b " +
            "WHERE b.status IN :statuses AND b.heldUntil < :now AND b.pendingAction IS NULL " +
            "ORDER BY b.heldUntil ASC")
    List<BookingEntity> findExpiredHolds(@Param("statuses") Collection<BookingStatus> statuses,
                                         @Param("now") LocalDateTime now,
                                         Pageable pageable);

    @Query("SELECT b FROM BookingEntity b " +
            "WHERE b.pendingAction IS NOT NULL AND b.actionClaimedAt < :claimedBefore " +
            "ORDER BY b.actionClaimedAt ASC")
    List<BookingEntity> findStaleClaims(@Param("claimedBefore") LocalDateTime claimedBefore, Pageable pageable);

    @Query("SELECT b FROM BookingEntity b " +
            "WHERE b.status = :status AND b.pendingAction IS NULL AND b.endAt < :now " +
            "ORDER BY b.endAt ASC")
    List<BookingEntity> findFinished(@Param("status") BookingStatus status,
                                     @Param("now") LocalDateTime now,
                                     Pageable pageable);
}
