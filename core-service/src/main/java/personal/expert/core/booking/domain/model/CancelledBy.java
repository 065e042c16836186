package personal.expert.core.booking.domain.model;

/**
 * 취소 주체
 */
public enum CancelledBy {
    LEARNER,
    EXPERT,
    SYSTEM
}
