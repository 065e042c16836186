package personal.expert.core.booking;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import personal.expert.core.booking.application.port.in.ReserveSlotCommand;
import personal.expert.core.booking.application.port.in.ReserveSlotUseCase;
import personal.expert.core.booking.application.port.in.ResolveBookingCommand;
import personal.expert.core.booking.application.port.in.ResolveBookingUseCase;
import personal.expert.core.booking.application.port.in.SweepExpiredBookingsUseCase;
import personal.expert.core.booking.application.port.in.SweepResult;
import personal.expert.core.booking.application.port.out.BookingRepository;
import personal.expert.core.booking.domain.exception.BookingAlreadyResolvedException;
import personal.expert.core.booking.domain.model.Booking;
import personal.expert.core.booking.domain.model.BookingStatus;
import personal.expert.core.booking.domain.model.CancelledBy;
import personal.expert.core.booking.domain.model.ExpertSession;
import personal.expert.core.booking.domain.model.PaymentStatus;
import personal.expert.core.booking.domain.model.Slot;
import personal.expert.core.payment.application.port.in.AuthorizePaymentCommand;
import personal.expert.core.payment.application.port.in.AuthorizePaymentUseCase;
import personal.expert.core.payment.application.port.in.IngestWebhookCommand;
import personal.expert.core.payment.application.port.in.IngestWebhookUseCase;
import personal.expert.core.payment.domain.model.PaymentHold;
import personal.expert.core.payment.domain.model.WebhookIngestResult;
import personal.expert.core.payment.domain.model.WebhookOutcome;
import personal.expert.core.support.IntegrationTestSupport;
import personal.expert.core.support.StripeWebhookSigner;

import java.time.LocalDateTime;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * 만료 정리(sweep) 통합 테스트
 * 기한이 지난 예약은 sweep 한 번으로 종결되고, 승인과 경쟁해도 하나의 종결만 반영된다.
 */
@DisplayName("만료 정리 통합 테스트")
class BookingSweepIntegrationTest extends IntegrationTestSupport {

    private static final Long LEARNER_ID = 10L;

    @Autowired
    private ReserveSlotUseCase reserveSlotUseCase;
    @Autowired
    private AuthorizePaymentUseCase authorizePaymentUseCase;
    @Autowired
    private IngestWebhookUseCase ingestWebhookUseCase;
    @Autowired
    private ResolveBookingUseCase resolveBookingUseCase;
    @Autowired
    private SweepExpiredBookingsUseCase sweepExpiredBookingsUseCase;
    @Autowired
    private BookingRepository bookingRepository;

    @Test
    @DisplayName("홀드 대기 시간이 지나면 sweep이 예약을 취소하고 슬롯을 복구한다")
    void expiredPendingBookingIsCancelled() {
        // given
        ExpertSession session = createSession();
        Slot slot = createSlot(session, 1);
        Booking booking = reserveSlotUseCase.reserve(new ReserveSlotCommand(LEARNER_ID, slot.id(), session.id(), null));

        // when
        SweepResult result = sweepExpiredBookingsUseCase.sweep(LocalDateTime.now().plusMinutes(20));

        // then
        assertThat(result.cancelledCount()).isEqualTo(1);
        Booking expired = bookingRepository.findById(booking.id()).orElseThrow();
        assertThat(expired.status()).isEqualTo(BookingStatus.CANCELLED);
        assertThat(expired.paymentStatus()).isEqualTo(PaymentStatus.CANCELLED);
        assertThat(expired.cancelledBy()).isEqualTo(CancelledBy.SYSTEM);
        assertThat(remainingCapacity(slot.id())).isEqualTo(1);
    }

    @Test
    @DisplayName("sweep은 반복 실행해도 같은 예약을 다시 처리하지 않는다")
    void sweepIsIdempotent() {
        // given
        ExpertSession session = createSession();
        Slot slot = createSlot(session, 1);
        reserveSlotUseCase.reserve(new ReserveSlotCommand(LEARNER_ID, slot.id(), session.id(), null));
        LocalDateTime sweepAt = LocalDateTime.now().plusMinutes(20);
        sweepExpiredBookingsUseCase.sweep(sweepAt);

        // when
        SweepResult second = sweepExpiredBookingsUseCase.sweep(sweepAt);

        // then
        assertThat(second.isEmpty()).isTrue();
        assertThat(remainingCapacity(slot.id())).isEqualTo(1);
    }

    @Test
    @DisplayName("만료 후 도착한 홀드 승인 이벤트는 예약을 되살리지 않고 홀드를 해제한다")
    void lateHoldAuthorizationDoesNotRevive() {
        // given
        ExpertSession session = createSession();
        Slot slot = createSlot(session, 1);
        Booking booking = reserveSlotUseCase.reserve(new ReserveSlotCommand(LEARNER_ID, slot.id(), session.id(), null));
        PaymentHold hold = authorizePaymentUseCase.authorize(
                new AuthorizePaymentCommand(booking.id(), LEARNER_ID, PRICE, CURRENCY));
        sweepExpiredBookingsUseCase.sweep(LocalDateTime.now().plusMinutes(20));

        // when
        String payload = StripeWebhookSigner.holdSucceeded("evt_late", booking.id(), hold.holdReference(), PRICE);
        WebhookIngestResult result = ingestWebhookUseCase.ingest(
                new IngestWebhookCommand(payload, StripeWebhookSigner.sign(payload)));

        // then
        assertThat(result).isEqualTo(WebhookIngestResult.ACCEPTED);
        Booking reloaded = bookingRepository.findById(booking.id()).orElseThrow();
        assertThat(reloaded.status()).isEqualTo(BookingStatus.CANCELLED);
        assertThat(jpaWebhookEventRepository.findByEventId("evt_late").orElseThrow().getOutcome())
                .isEqualTo(WebhookOutcome.DISCARDED);
        assertThat(remainingCapacity(slot.id())).isEqualTo(1);
    }

    @Test
    @DisplayName("승인 기한이 지난 뒤 sweep이 먼저 종결하면 전문가 승인은 409")
    void approvalAfterExpiryIsRejected() {
        // given
        Booking booking = awaitingApproval(createSlot(createSession(), 1));
        sweepExpiredBookingsUseCase.sweep(LocalDateTime.now().plusHours(25));

        // when & then
        assertThatThrownBy(() -> resolveBookingUseCase.resolve(new ResolveBookingCommand(
                booking.id(), EXPERT_ID, ResolveBookingCommand.Decision.CONFIRM, null, null)))
                .isInstanceOf(BookingAlreadyResolvedException.class);
        assertThat(bookingRepository.findById(booking.id()).orElseThrow().paymentStatus())
                .isEqualTo(PaymentStatus.CANCELLED);
    }

    @Test
    @DisplayName("승인과 sweep이 동시에 실행되어도 하나의 일관된 종결만 남는다")
    void approvalAndSweepRaceConverges() throws InterruptedException {
        // given
        Slot slot = createSlot(createSession(), 1);
        Booking booking = awaitingApproval(slot);
        ExecutorService executor = Executors.newFixedThreadPool(2);
        CountDownLatch ready = new CountDownLatch(1);
        CountDownLatch done = new CountDownLatch(2);

        // when
        executor.submit(() -> runAfter(ready, done, () -> resolveBookingUseCase.resolve(new ResolveBookingCommand(
                booking.id(), EXPERT_ID, ResolveBookingCommand.Decision.CONFIRM, null, null))));
        executor.submit(() -> runAfter(ready, done,
                () -> sweepExpiredBookingsUseCase.sweep(LocalDateTime.now().plusHours(25))));
        ready.countDown();
        assertThat(done.await(30, TimeUnit.SECONDS)).isTrue();
        executor.shutdown();

        // then
        Booking settled = bookingRepository.findById(booking.id()).orElseThrow();
        assertThat(settled.pendingAction()).isNull();
        if (settled.status() == BookingStatus.CONFIRMED) {
            assertThat(settled.paymentStatus()).isEqualTo(PaymentStatus.CAPTURED);
            assertThat(remainingCapacity(slot.id())).isZero();
        } else {
            assertThat(settled.status()).isEqualTo(BookingStatus.CANCELLED);
            assertThat(settled.paymentStatus()).isEqualTo(PaymentStatus.CANCELLED);
            assertThat(remainingCapacity(slot.id())).isEqualTo(1);
        }
    }

    private void runAfter(CountDownLatch ready, CountDownLatch done, Runnable action) {
        try {
            ready.await();
            action.run();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (BookingAlreadyResolvedException e) {
            // 경쟁에서 진 쪽
        } finally {
            done.countDown();
        }
    }

    private Booking awaitingApproval(Slot slot) {
        Booking booking = reserveSlotUseCase.reserve(new ReserveSlotCommand(LEARNER_ID, slot.id(), slot.sessionId(), null));
        PaymentHold hold = authorizePaymentUseCase.authorize(
                new AuthorizePaymentCommand(booking.id(), LEARNER_ID, PRICE, CURRENCY));
        String payload = StripeWebhookSigner.holdSucceeded("evt_hold_" + booking.id(), booking.id(),
                hold.holdReference(), PRICE);
        ingestWebhookUseCase.ingest(new IngestWebhookCommand(payload, StripeWebhookSigner.sign(payload)));
        return bookingRepository.findById(booking.id()).orElseThrow();
    }
}
