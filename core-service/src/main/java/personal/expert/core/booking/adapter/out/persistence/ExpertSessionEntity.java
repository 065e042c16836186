package personal.expert.core.booking.adapter.out.persistence;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import personal.expert.core.booking.domain.model.ExpertSession;

/**
 * Expert Session JPA Entity
 */
@Entity
@Table(name = "expert_sessions",
        indexes = @Index(name = "idx_expert_id", columnList = "expert_id"))
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class ExpertSessionEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "expert_id", nullable = false)
    private Long expertId;

    @Column(nullable = false, length = 200)
    private String title;

    @Column(name = "price_amount", nullable = false)
    private long priceAmount;

    @Column(nullable = false, length = 3)
    private String currency;

    public static ExpertSessionEntity fromDomain(ExpertSession session) {
        ExpertSessionEntity entity = new ExpertSessionEntity();
        entity.id = session.id();
        entity.expertId = session.expertId();
        entity.title = session.title();
        entity.priceAmount = session.priceAmount();
        entity.currency = session.currency();
        return entity;
    }

    public ExpertSession toDomain() {
        return new ExpertSession(id, expertId, title, priceAmount, currency);
    }
}
