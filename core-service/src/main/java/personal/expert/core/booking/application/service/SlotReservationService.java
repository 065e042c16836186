package personal.expert.core.booking.application.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import personal.expert.core.booking.application.port.in.ReserveSlotCommand;
import personal.expert.core.booking.application.port.in.ReserveSlotUseCase;
import personal.expert.core.booking.domain.exception.ConcurrentReservationException;
import personal.expert.core.booking.domain.model.Booking;
import personal.expert.core.booking.domain.service.BookingManager;

import java.time.Clock;
import java.time.LocalDateTime;

/**
 * Slot Reservation Service (SRP)
 * 단일 책임: 슬롯 예약 처리
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SlotReservationService implements ReserveSlotUseCase {

    private final BookingManager bookingManager;
    private final Clock clock;

    @Override
    public Booking reserve(ReserveSlotCommand command) {
        try {
            var saved = bookingManager.reserveInTransaction(command, LocalDateTime.now(clock));

            log.info("Slot reserved: bookingId={}, slotId={}, learnerId={}, heldUntil={}",
                    saved.id(), command.slotId(), command.learnerId(), saved.heldUntil());
            return saved;

        } catch (DataIntegrityViolationException e) {
            log.warn("Concurrent reservation detected: slotId={}, learnerId={}", command.slotId(), command.learnerId());
            throw new ConcurrentReservationException(command.slotId());

        } catch (ConcurrencyFailureException e) {
            log.warn("Reservation conflict persisted after retries: slotId={}", command.slotId());
            throw new ConcurrentReservationException(command.slotId());
        }
    }
}
