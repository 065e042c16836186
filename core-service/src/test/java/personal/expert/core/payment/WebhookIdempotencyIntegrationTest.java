package personal.expert.core.payment;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import personal.expert.core.booking.application.port.in.ReserveSlotCommand;
import personal.expert.core.booking.application.port.in.ReserveSlotUseCase;
import personal.expert.core.booking.application.port.out.BookingRepository;
import personal.expert.core.booking.domain.model.Booking;
import personal.expert.core.booking.domain.model.BookingStatus;
import personal.expert.core.booking.domain.model.ExpertSession;
import personal.expert.core.booking.domain.model.PaymentStatus;
import personal.expert.core.booking.domain.model.Slot;
import personal.expert.core.payment.application.port.in.AuthorizePaymentCommand;
import personal.expert.core.payment.application.port.in.AuthorizePaymentUseCase;
import personal.expert.core.payment.application.port.in.IngestWebhookCommand;
import personal.expert.core.payment.application.port.in.IngestWebhookUseCase;
import personal.expert.core.payment.domain.exception.InvalidWebhookSignatureException;
import personal.expert.core.payment.domain.model.PaymentHold;
import personal.expert.core.payment.domain.model.WebhookIngestResult;
import personal.expert.core.payment.domain.model.WebhookOutcome;
import personal.expert.core.support.IntegrationTestSupport;
import personal.expert.core.support.StripeWebhookSigner;

import java.time.Instant;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Webhook 중복/재전송 통합 테스트
 * 같은 event_id는 몇 번이 들어오든 원장에 한 번만 기록되고 한 번만 반영된다.
 */
@DisplayName("Webhook 멱등성 통합 테스트")
class WebhookIdempotencyIntegrationTest extends IntegrationTestSupport {

    private static final Long LEARNER_ID = 10L;

    @Autowired
    private ReserveSlotUseCase reserveSlotUseCase;
    @Autowired
    private AuthorizePaymentUseCase authorizePaymentUseCase;
    @Autowired
    private IngestWebhookUseCase ingestWebhookUseCase;
    @Autowired
    private BookingRepository bookingRepository;

    @Test
    @DisplayName("같은 이벤트를 재전송하면 두 번째는 DUPLICATE이고 원장에는 한 건만 남는다")
    void replayedEventIsRecordedOnce() {
        // given
        Booking booking = reserveWithHold();
        String payload = StripeWebhookSigner.holdSucceeded("evt_replay", booking.id(), booking.holdReference(), PRICE);

        // when
        WebhookIngestResult first = ingestWebhookUseCase.ingest(
                new IngestWebhookCommand(payload, StripeWebhookSigner.sign(payload)));
        WebhookIngestResult second = ingestWebhookUseCase.ingest(
                new IngestWebhookCommand(payload, StripeWebhookSigner.sign(payload)));

        // then
        assertThat(first).isEqualTo(WebhookIngestResult.ACCEPTED);
        assertThat(second).isEqualTo(WebhookIngestResult.DUPLICATE);
        assertThat(jpaWebhookEventRepository.countByEventId("evt_replay")).isEqualTo(1);
        assertThat(jpaWebhookEventRepository.findByEventId("evt_replay").orElseThrow().getOutcome())
                .isEqualTo(WebhookOutcome.APPLIED);
        assertThat(bookingRepository.findById(booking.id()).orElseThrow().status())
                .isEqualTo(BookingStatus.PENDING_APPROVAL);
    }

    @Test
    @DisplayName("같은 이벤트가 동시에 도착해도 정확히 한 번만 반영된다")
    void concurrentDuplicatesApplyOnce() throws InterruptedException {
        // given
        Booking booking = reserveWithHold();
        String payload = StripeWebhookSigner.holdSucceeded("evt_concurrent", booking.id(), booking.holdReference(), PRICE);
        String signature = StripeWebhookSigner.sign(payload);
        int deliveries = 5;
        ExecutorService executor = Executors.newFixedThreadPool(deliveries);
        CountDownLatch ready = new CountDownLatch(1);
        CountDownLatch done = new CountDownLatch(deliveries);
        AtomicInteger accepted = new AtomicInteger();

        // when
        for (int i = 0; i < deliveries; i++) {
            executor.submit(() -> {
                try {
                    ready.await();
                    if (ingestWebhookUseCase.ingest(new IngestWebhookCommand(payload, signature))
                            == WebhookIngestResult.ACCEPTED) {
                        accepted.incrementAndGet();
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                } catch (RuntimeException e) {
                    // 충돌로 거부된 전달은 결제사가 다시 보낸다
                } finally {
                    done.countDown();
                }
            });
        }
        ready.countDown();
        assertThat(done.await(30, TimeUnit.SECONDS)).isTrue();
        executor.shutdown();

        // then
        assertThat(accepted.get()).isEqualTo(1);
        assertThat(jpaWebhookEventRepository.countByEventId("evt_concurrent")).isEqualTo(1);
        Booking reloaded = bookingRepository.findById(booking.id()).orElseThrow();
        assertThat(reloaded.status()).isEqualTo(BookingStatus.PENDING_APPROVAL);
        assertThat(reloaded.paymentStatus()).isEqualTo(PaymentStatus.AUTHORIZED);
    }

    @Test
    @DisplayName("서명이 틀린 이벤트는 아무것도 기록하지 않는다")
    void invalidSignatureLeavesNoTrace() {
        // given
        Booking booking = reserveWithHold();
        String payload = StripeWebhookSigner.holdSucceeded("evt_forged", booking.id(), booking.holdReference(), PRICE);
        String forged = StripeWebhookSigner.sign(payload, "whsec_wrong", Instant.now().getEpochSecond());

        // when & then
        assertThatThrownBy(() -> ingestWebhookUseCase.ingest(new IngestWebhookCommand(payload, forged)))
                .isInstanceOf(InvalidWebhookSignatureException.class);
        assertThat(jpaWebhookEventRepository.existsByEventId("evt_forged")).isFalse();
        assertThat(bookingRepository.findById(booking.id()).orElseThrow().status()).isEqualTo(BookingStatus.PENDING);
    }

    @Test
    @DisplayName("오래된 타임스탬프의 서명은 거부된다")
    void staleTimestampIsRejected() {
        // given
        Booking booking = reserveWithHold();
        String payload = StripeWebhookSigner.holdSucceeded("evt_stale", booking.id(), booking.holdReference(), PRICE);
        String stale = StripeWebhookSigner.sign(payload, StripeWebhookSigner.TEST_SECRET,
                Instant.now().minusSeconds(3600).getEpochSecond());

        // when & then
        assertThatThrownBy(() -> ingestWebhookUseCase.ingest(new IngestWebhookCommand(payload, stale)))
                .isInstanceOf(InvalidWebhookSignatureException.class);
    }

    @Test
    @DisplayName("처리하지 않는 이벤트 유형은 IGNORED로 기록된다")
    void unhandledEventIsIgnored() {
        // given
        String payload = "{\"id\":\"evt_other\",\"type\":\"customer.created\",\"data\":{\"object\":{\"id\":\"cus_1\"}}}";

        // when
        WebhookIngestResult result = ingestWebhookUseCase.ingest(
                new IngestWebhookCommand(payload, StripeWebhookSigner.sign(payload)));

        // then
        assertThat(result).isEqualTo(WebhookIngestResult.ACCEPTED);
        assertThat(jpaWebhookEventRepository.findByEventId("evt_other").orElseThrow().getOutcome())
                .isEqualTo(WebhookOutcome.IGNORED);
    }

    private Booking reserveWithHold() {
        ExpertSession session = createSession();
        Slot slot = createSlot(session, 1);
        Booking booking = reserveSlotUseCase.reserve(new ReserveSlotCommand(LEARNER_ID, slot.id(), session.id(), null));
        PaymentHold hold = authorizePaymentUseCase.authorize(
                new AuthorizePaymentCommand(booking.id(), LEARNER_ID, PRICE, CURRENCY));
        assertThat(hold.holdReference()).isNotBlank();
        return bookingRepository.findById(booking.id()).orElseThrow();
    }
}
