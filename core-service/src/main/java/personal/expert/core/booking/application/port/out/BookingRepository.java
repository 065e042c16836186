package personal.expert.core.booking.application.port.out;

import personal.expert.core.booking.domain.model.Booking;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Booking Repository Port
 * 저장은 version 비교로 원자적으로 수행되며, 다른 트랜잭션이 먼저 변경한 경우
 * ConcurrencyFailureException 계열 예외가 발생한다.
 */
public interface BookingRepository {

    Booking save(Booking booking);

    Optional<Booking> findById(Long bookingId);

    Optional<Booking> findByHoldReference(String holdReference);

    /**
     * 학습자가 해당 슬롯에 활성 예약(PENDING, PENDING_APPROVAL, CONFIRMED)을 가지고 있는지
     */
    boolean existsActiveBooking(Long slotId, Long learnerId);

    /**
     * held_until이 지났고 선점되지 않은 PENDING / PENDING_APPROVAL 예약
     */
    List<Booking> findExpiredHolds(LocalDateTime now, int limit);

    /**
     * claimedBefore 이전에 선점된 후 종결되지 않은 예약
     */
    List<Booking> findStaleClaims(LocalDateTime claimedBefore, int limit);

    /**
     * 세션 종료 시각이 지난 CONFIRMED 예약
     */
    List<Booking> findFinishedBookings(LocalDateTime now, int limit);

    List<Booking> findPendingApprovals(Long expertId);
}
