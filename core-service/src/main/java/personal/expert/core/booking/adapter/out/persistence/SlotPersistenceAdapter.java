package personal.expert.core.booking.adapter.out.persistence;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import personal.expert.core.booking.application.port.out.SlotRepository;
import personal.expert.core.booking.domain.model.Slot;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Slot Persistence Adapter (Reservation Guard)
 * 잔여 수량 변경은 조건부 UPDATE의 영향 행 수로 성공 여부를 판단한다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SlotPersistenceAdapter implements SlotRepository {

    private final JpaSlotRepository jpaSlotRepository;

    @Override
    public Slot save(Slot slot) {
        log.debug("Saving slot: slotId={}, sessionId={}, startAt={}", slot.id(), slot.sessionId(), slot.startAt());
        return jpaSlotRepository.save(SlotEntity.fromDomain(slot)).toDomain();
    }

    @Override
    public Optional<Slot> findById(Long slotId) {
        return jpaSlotRepository.findById(slotId)
                .map(SlotEntity::toDomain);
    }

    @Override
    public boolean claimCapacity(Long slotId) {
        int updated = jpaSlotRepository.decrementRemaining(slotId);
        log.debug("Slot claim: slotId={}, updated={}", slotId, updated);
        return updated == 1;
    }

    @Override
    public boolean releaseCapacity(Long slotId) {
        int updated = jpaSlotRepository.incrementRemaining(slotId);
        log.debug("Slot release: slotId={}, updated={}", slotId, updated);
        return updated == 1;
    }

    @Override
    public List<Slot> findOfferedSlots(Long sessionId, LocalDateTime from, LocalDateTime to) {
        return jpaSlotRepository.findOffered(sessionId, from, to)
                .stream()
                .map(SlotEntity::toDomain)
                .toList();
    }
}
