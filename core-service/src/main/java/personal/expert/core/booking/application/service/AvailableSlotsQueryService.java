package personal.expert.core.booking.application.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import personal.expert.core.booking.application.config.BookingProperties;
import personal.expert.core.booking.application.port.in.GetAvailableSlotsUseCase;
import personal.expert.core.booking.application.port.out.ExpertSessionRepository;
import personal.expert.core.booking.application.port.out.SlotRepository;
import personal.expert.core.booking.domain.exception.SessionNotFoundException;
import personal.expert.core.booking.domain.model.Slot;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Available Slots Query Service
 * 예약 가능 시간 범위(최소 선행 시간 ~ 최대 예약 기간) 안의 잔여 슬롯 조회
 */
@Slf4j
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class AvailableSlotsQueryService implements GetAvailableSlotsUseCase {

    private final SlotRepository slotRepository;
    private final ExpertSessionRepository expertSessionRepository;
    private final BookingProperties bookingProperties;
    private final Clock clock;

    @Override
    public List<Slot> getAvailableSlots(Long sessionId) {
        expertSessionRepository.findById(sessionId)
                .orElseThrow(() -> new SessionNotFoundException(sessionId));

        var reservation = bookingProperties.reservation();
        LocalDateTime now = LocalDateTime.now(clock);
        List<Slot> slots = slotRepository.findOfferedSlots(
                sessionId, now.plus(reservation.minLeadTime()), now.plus(reservation.maxAdvance()));

        log.debug("Available slots: sessionId={}, count={}", sessionId, slots.size());
        return slots;
    }
}
