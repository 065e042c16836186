package personal.expert.core.booking.application.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import personal.expert.core.booking.application.config.BookingProperties;
import personal.expert.core.booking.application.port.in.SweepExpiredBookingsUseCase;
import personal.expert.core.booking.application.port.in.SweepResult;
import personal.expert.core.booking.application.port.out.BookingRepository;
import personal.expert.core.booking.domain.exception.BookingAlreadyResolvedException;
import personal.expert.core.booking.domain.model.Booking;
import personal.expert.core.booking.domain.service.BookingManager;
import personal.expert.core.payment.application.port.in.ReleaseCommand;
import personal.expert.core.payment.application.port.in.SettlePaymentUseCase;

import java.time.LocalDateTime;

/**
 * Booking Sweep Service (Timeout Reaper)
 * <p>
 * 1. held_until이 지난 PENDING / PENDING_APPROVAL 예약을 EXPIRE 선점 후 홀드 해제
 * 2. claimTimeout보다 오래된 선점을 이어서 마무리 (결제사 호출 후 반영 전 중단된 건)
 * 3. 세션이 끝난 CONFIRMED 예약을 COMPLETED로 전이
 * <p>
 * 승인/거절과 같은 선점 경쟁을 거치므로 한 예약에는 하나의 종결 전이만 반영된다.
 * 개별 예약 실패는 로그만 남기고 다음 예약을 계속 처리한다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BookingSweepService implements SweepExpiredBookingsUseCase {

    private final BookingRepository bookingRepository;
    private final BookingManager bookingManager;
    private final SettlePaymentUseCase settlePaymentUseCase;
    private final BookingProperties bookingProperties;

    @Override
    public SweepResult sweep(LocalDateTime now) {
        var reaper = bookingProperties.reaper();

        int cancelled = expireHolds(now, reaper.batchSize());
        int recovered = recoverStaleClaims(now.minus(reaper.claimTimeout()), now, reaper.batchSize());
        int completed = completeFinished(now, reaper.batchSize());

        SweepResult result = new SweepResult(cancelled, completed, recovered);
        if (!result.isEmpty()) {
            log.info("Sweep finished: cancelled={}, completed={}, recovered={}", cancelled, completed, recovered);
        }
        return result;
    }

    private int expireHolds(LocalDateTime now, int batchSize) {
        int count = 0;
        for (Booking booking : bookingRepository.findExpiredHolds(now, batchSize)) {
            try {
                settlePaymentUseCase.release(ReleaseCommand.expire(booking.id(), now));
                count++;
            } catch (BookingAlreadyResolvedException e) {
                log.info("Expired booking resolved concurrently: bookingId={}", booking.id());
            } catch (RuntimeException e) {
                log.error("Failed to expire booking: bookingId={}", booking.id(), e);
            }
        }
        return count;
    }

    private int recoverStaleClaims(LocalDateTime claimedBefore, LocalDateTime now, int batchSize) {
        int count = 0;
        for (Booking booking : bookingRepository.findStaleClaims(claimedBefore, batchSize)) {
            try {
                log.warn("Resuming stale claim: bookingId={}, action={}, claimedAt={}",
                        booking.id(), booking.pendingAction(), booking.actionClaimedAt());
                settlePaymentUseCase.resume(booking.id(), now);
                count++;
            } catch (RuntimeException e) {
                log.error("Failed to resume claim: bookingId={}, action={}", booking.id(), booking.pendingAction(), e);
            }
        }
        return count;
    }

    private int completeFinished(LocalDateTime now, int batchSize) {
        int count = 0;
        for (Booking booking : bookingRepository.findFinishedBookings(now, batchSize)) {
            try {
                bookingManager.complete(booking.id(), now);
                count++;
            } catch (RuntimeException e) {
                log.error("Failed to complete booking: bookingId={}", booking.id(), e);
            }
        }
        return count;
    }
}
