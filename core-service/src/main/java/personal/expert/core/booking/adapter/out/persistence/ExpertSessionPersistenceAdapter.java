package personal.expert.core.booking.adapter.out.persistence;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import personal.expert.core.booking.application.port.out.ExpertSessionRepository;
import personal.expert.core.booking.domain.model.ExpertSession;

import java.util.Optional;

/**
 * Expert Session Persistence Adapter
 */
@Component
@RequiredArgsConstructor
public class ExpertSessionPersistenceAdapter implements ExpertSessionRepository {

    private final JpaExpertSessionRepository jpaExpertSessionRepository;

    @Override
    public ExpertSession save(ExpertSession session) {
        return jpaExpertSessionRepository.save(ExpertSessionEntity.fromDomain(session)).toDomain();
    }

    @Override
    public Optional<ExpertSession> findById(Long sessionId) {
        return jpaExpertSessionRepository.findById(sessionId)
                .map(ExpertSessionEntity::toDomain);
    }
}
