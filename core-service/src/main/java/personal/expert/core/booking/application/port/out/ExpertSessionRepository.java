package personal.expert.core.booking.application.port.out;

import personal.expert.core.booking.domain.model.ExpertSession;

import java.util.Optional;

/**
 * Expert Session Repository Port
 */
public interface ExpertSessionRepository {

    ExpertSession save(ExpertSession session);

    Optional<ExpertSession> findById(Long sessionId);
}
