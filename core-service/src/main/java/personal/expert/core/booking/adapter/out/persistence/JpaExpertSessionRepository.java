package personal.expert.core.booking.adapter.out.persistence;

import org.springframework.data.jpa.repository.JpaRepository;

/**
 * Spring Data JPA Repository for ExpertSession
 */
public interface JpaExpertSessionRepository extends JpaRepository<ExpertSessionEntity, Long> {
}
