package personal.expert.core.support;

import personal.expert.core.booking.application.config.BookingProperties;
import personal.expert.core.booking.domain.model.Booking;
import personal.expert.core.booking.domain.model.BookingAction;
import personal.expert.core.booking.domain.model.BookingStatus;
import personal.expert.core.booking.domain.model.CancelledBy;
import personal.expert.core.booking.domain.model.PaymentStatus;
import personal.expert.core.payment.application.config.PaymentProperties;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;

/**
 * 단위 테스트용 예약/설정 픽스처
 */
public final class BookingFixtures {

    public static final Long BOOKING_ID = 100L;
    public static final Long LEARNER_ID = 10L;
    public static final Long EXPERT_ID = 20L;
    public static final Long SLOT_ID = 1L;
    public static final Long SESSION_ID = 2L;
    public static final long AMOUNT = 5000L;
    public static final String CURRENCY = "usd";
    public static final String HOLD_REFERENCE = "pi_test_100";
    public static final LocalDateTime NOW = LocalDateTime.of(2030, 1, 1, 9, 0);

    private BookingFixtures() {
    }

    public static Clock fixedClock() {
        return Clock.fixed(NOW.toInstant(ZoneOffset.UTC), ZoneOffset.UTC);
    }

    public static BookingProperties bookingProperties() {
        return new BookingProperties(
                new BookingProperties.Reservation(Duration.ofMinutes(15), Duration.ofHours(2), Duration.ofDays(90)),
                new BookingProperties.Approval(Duration.ofHours(24)),
                new BookingProperties.Reaper(true, 60_000L, 100, Duration.ofMinutes(5)),
                new BookingProperties.Cancellation(Duration.ofHours(24), Duration.ofHours(2), 50),
                new BookingProperties.Sweep("test-sweep-secret"),
                new BookingProperties.Outbox(true, 500L));
    }

    public static PaymentProperties paymentProperties() {
        return new PaymentProperties("fake", List.of("usd", "eur", "dkk"),
                new PaymentProperties.Stripe("sk_test", "whsec_test", 300L, null));
    }

    /**
     * 3일 뒤 시작하는 PENDING/PENDING 예약
     */
    public static Booking pending() {
        return Booking.builder()
                .id(BOOKING_ID)
                .learnerId(LEARNER_ID)
                .expertId(EXPERT_ID)
                .slotId(SLOT_ID)
                .sessionId(SESSION_ID)
                .startAt(NOW.plusDays(3))
                .endAt(NOW.plusDays(3).plusHours(1))
                .amount(AMOUNT)
                .currency(CURRENCY)
                .status(BookingStatus.PENDING)
                .paymentStatus(PaymentStatus.PENDING)
                .heldUntil(NOW.plusMinutes(15))
                .createdAt(NOW)
                .updatedAt(NOW)
                .version(0L)
                .build();
    }

    public static Booking awaitingApproval() {
        return pending().authorize(HOLD_REFERENCE, NOW, Duration.ofHours(24));
    }

    public static Booking confirmed() {
        return awaitingApproval()
                .claim(BookingAction.CONFIRM, CancelledBy.EXPERT, null, null, NOW)
                .completeCapture(AMOUNT, NOW);
    }

    public static Booking startingAt(Booking booking, LocalDateTime startAt) {
        return booking.toBuilder().startAt(startAt).endAt(startAt.plusHours(1)).build();
    }
}
