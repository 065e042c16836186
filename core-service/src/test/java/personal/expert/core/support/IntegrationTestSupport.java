package personal.expert.core.support;

import org.junit.jupiter.api.AfterEach;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import personal.expert.core.booking.adapter.out.persistence.ExpertSessionEntity;
import personal.expert.core.booking.adapter.out.persistence.JpaBookingRepository;
import personal.expert.core.booking.adapter.out.persistence.JpaExpertSessionRepository;
import personal.expert.core.booking.adapter.out.persistence.JpaOutboxEventRepository;
import personal.expert.core.booking.adapter.out.persistence.JpaSlotRepository;
import personal.expert.core.booking.application.port.out.SlotRepository;
import personal.expert.core.booking.domain.model.ExpertSession;
import personal.expert.core.booking.domain.model.Slot;
import personal.expert.core.payment.adapter.out.persistence.JpaWebhookEventRepository;

import java.time.LocalDateTime;

/**
 * 통합 테스트 공통 설정
 * H2(MySQL 모드) + Fake 결제사로 전체 컨텍스트를 띄운다.
 */
@SpringBootTest
@ActiveProfiles("test")
public abstract class IntegrationTestSupport {

    protected static final long PRICE = 5000L;
    protected static final String CURRENCY = "usd";
    protected static final Long EXPERT_ID = 20L;

    @Autowired
    protected SlotRepository slotRepository;
    @Autowired
    protected JpaSlotRepository jpaSlotRepository;
    @Autowired
    protected JpaExpertSessionRepository jpaExpertSessionRepository;
    @Autowired
    protected JpaBookingRepository jpaBookingRepository;
    @Autowired
    protected JpaWebhookEventRepository jpaWebhookEventRepository;
    @Autowired
    protected JpaOutboxEventRepository jpaOutboxEventRepository;

    @AfterEach
    void cleanUp() {
        jpaWebhookEventRepository.deleteAllInBatch();
        jpaOutboxEventRepository.deleteAllInBatch();
        jpaBookingRepository.deleteAllInBatch();
        jpaSlotRepository.deleteAllInBatch();
        jpaExpertSessionRepository.deleteAllInBatch();
    }

    protected ExpertSession createSession() {
        return jpaExpertSessionRepository.save(ExpertSessionEntity.fromDomain(
                new ExpertSession(null, EXPERT_ID, "Career coaching", PRICE, CURRENCY))).toDomain();
    }

    /**
     * 3일 뒤 시작하는 1시간짜리 슬롯
     */
    protected Slot createSlot(ExpertSession session, int capacity) {
        LocalDateTime startAt = LocalDateTime.now().plusDays(3).withNano(0);
        return slotRepository.save(
                Slot.open(session.expertId(), session.id(), startAt, startAt.plusHours(1), capacity));
    }

    protected int remainingCapacity(Long slotId) {
        return jpaSlotRepository.findById(slotId).orElseThrow().getRemainingCapacity();
    }
}
