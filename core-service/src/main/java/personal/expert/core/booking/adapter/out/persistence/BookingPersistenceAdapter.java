package personal.expert.core.booking.adapter.out.persistence;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Component;
import personal.expert.core.booking.application.port.out.BookingRepository;
import personal.expert.core.booking.domain.model.Booking;
import personal.expert.core.booking.domain.model.BookingStatus;

import java.time.LocalDateTime;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;

/**
 * Booking Persistence Adapter
 * JPA를 사용한 예약 저장소 구현체
 * <p>
 * saveAndFlush로 UPDATE ... WHERE version = ? 를 즉시 실행하여,
 * 다른 트랜잭션이 먼저 변경한 경우 호출 시점에 ObjectOptimisticLockingFailureException이 발생한다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class BookingPersistenceAdapter implements BookingRepository {

    private static final EnumSet<BookingStatus> HOLDING_STATUSES =
            EnumSet.of(BookingStatus.PENDING, BookingStatus.PENDING_APPROVAL);

    private final JpaBookingRepository jpaBookingRepository;

    @Override
    public Booking save(Booking booking) {
        log.debug("Saving booking: bookingId={}, status={}, paymentStatus={}, version={}",
                booking.id(), booking.status(), booking.paymentStatus(), booking.version());

        var entity = BookingEntity.fromDomain(booking);
        return jpaBookingRepository.saveAndFlush(entity).toDomain();
    }

    @Override
    public Optional<Booking> findById(Long bookingId) {
        return jpaBookingRepository.findById(bookingId)
                .map(BookingEntity::toDomain);
    }

    @Override
    public Optional<Booking> findByHoldReference(String holdReference) {
        return jpaBookingRepository.findByHoldReference(holdReference)
                .map(BookingEntity::toDomain);
    }

    @Override
    public boolean existsActiveBooking(Long slotId, Long learnerId) {
        return jpaBookingRepository.existsBySlotIdAndLearnerIdAndStatusIn(
                slotId, learnerId, BookingStatus.activeStatuses());
    }

    @Override
    public List<Booking> findExpiredHolds(LocalDateTime now, int limit) {
        return jpaBookingRepository.findExpiredHolds(HOLDING_STATUSES, now, PageRequest.of(0, limit))
                .stream()
                .map(BookingEntity::toDomain)
                .toList();
    }

    @Override
    public List<Booking> findStaleClaims(LocalDateTime claimedBefore, int limit) {
        return jpaBookingRepository.findStaleClaims(claimedBefore, PageRequest.of(0, limit))
                .stream()
                .map(BookingEntity::toDomain)
                .toList();
    }

    @Override
    public List<Booking> findFinishedBookings(LocalDateTime now, int limit) {
        return jpaBookingRepository.findFinished(BookingStatus.CONFIRMED, now, PageRequest.of(0, limit))
                .stream()
                .map(BookingEntity::toDomain)
                .toList();
    }

    @Override
    public List<Booking> findPendingApprovals(Long expertId) {
        return jpaBookingRepository.findByExpertIdAndStatusOrderByHeldUntilAsc(expertId, BookingStatus.PENDING_APPROVAL)
                .stream()
                .map(BookingEntity::toDomain)
                .toList();
    }
}
