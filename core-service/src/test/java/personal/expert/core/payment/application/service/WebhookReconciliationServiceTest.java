package personal.expert.core.payment.application.service;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import personal.expert.core.payment.application.port.in.IngestWebhookCommand;
import personal.expert.core.payment.application.port.out.PaymentEventVerifier;
import personal.expert.core.payment.application.port.out.PaymentGateway;
import personal.expert.core.payment.application.port.out.WebhookEventRepository;
import personal.expert.core.payment.domain.exception.InvalidWebhookSignatureException;
import personal.expert.core.payment.domain.model.HoldCancellation;
import personal.expert.core.payment.domain.model.IdempotencyKeys;
import personal.expert.core.payment.domain.model.PaymentEvent;
import personal.expert.core.payment.domain.model.PaymentEventType;
import personal.expert.core.payment.domain.model.WebhookApplication;
import personal.expert.core.payment.domain.model.WebhookIngestResult;
import personal.expert.core.payment.domain.model.WebhookOutcome;
import personal.expert.core.payment.domain.service.PaymentEventManager;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static personal.expert.core.support.BookingFixtures.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("WebhookReconciliationService 단위 테스트")
class WebhookReconciliationServiceTest {

    private static final String PAYLOAD = "{\"id\":\"evt_1\"}";
    private static final String SIGNATURE = "t=1,v1=abc";

    @Mock
    private PaymentEventVerifier paymentEventVerifier;
    @Mock
    private PaymentEventManager paymentEventManager;
    @Mock
    private WebhookEventRepository webhookEventRepository;
    @Mock
    private PaymentGateway paymentGateway;

    private SimpleMeterRegistry meterRegistry;
    private WebhookReconciliationService service;

    private final PaymentEvent holdSucceeded = new PaymentEvent("evt_1", PaymentEventType.HOLD_SUCCEEDED,
            "payment_intent.amount_capturable_updated", BOOKING_ID, HOLD_REFERENCE, AMOUNT);

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        service = new WebhookReconciliationService(paymentEventVerifier, paymentEventManager,
                webhookEventRepository, paymentGateway, meterRegistry, fixedClock());
    }

    private double counted(String outcome) {
        return meterRegistry.counter("payment.webhook.events", "outcome", outcome).count();
    }

    @Test
    @DisplayName("서명 검증 실패 시 상태를 건드리지 않고 예외를 전파한다")
    void ingest_InvalidSignature() {
        // given
        given(paymentEventVerifier.verify(PAYLOAD, SIGNATURE))
                .willThrow(new InvalidWebhookSignatureException("bad signature"));

        // when & then
        assertThatThrownBy(() -> service.ingest(new IngestWebhookCommand(PAYLOAD, SIGNATURE)))
                .isInstanceOf(InvalidWebhookSignatureException.class);
        verifyNoInteractions(paymentEventManager, webhookEventRepository, paymentGateway);
        assertThat(counted("rejected")).isEqualTo(1.0);
    }

    @Test
    @DisplayName("처음 수신한 이벤트는 반영 후 ACCEPTED")
    void ingest_Applied() {
        // given
        given(paymentEventVerifier.verify(PAYLOAD, SIGNATURE)).willReturn(holdSucceeded);
        given(webhookEventRepository.existsByEventId("evt_1")).willReturn(false);
        given(paymentEventManager.apply(holdSucceeded, NOW))
                .willReturn(WebhookApplication.of(WebhookOutcome.APPLIED, BOOKING_ID));

        // when
        WebhookIngestResult result = service.ingest(new IngestWebhookCommand(PAYLOAD, SIGNATURE));

        // then
        assertThat(result).isEqualTo(WebhookIngestResult.ACCEPTED);
        assertThat(counted("applied")).isEqualTo(1.0);
    }

    @Test
    @DisplayName("원장에 있는 이벤트는 반영하지 않고 DUPLICATE")
    void ingest_DuplicateFastPath() {
        // given
        given(webhookEventRepository.existsByEventId("evt_1")).willReturn(true);

        // when
        WebhookIngestResult result = service.ingest(holdSucceeded);

        // then
        assertThat(result).isEqualTo(WebhookIngestResult.DUPLICATE);
        verifyNoInteractions(paymentEventManager);
    }

    @Test
    @DisplayName("동시 수신으로 원장 유니크 제약에 걸리면 DUPLICATE")
    void ingest_DuplicateOnLedgerInsert() {
        // given
        given(webhookEventRepository.existsByEventId("evt_1")).willReturn(false);
        given(paymentEventManager.apply(holdSucceeded, NOW))
                .willThrow(new DataIntegrityViolationException("uk_event_id"));

        // when
        WebhookIngestResult result = service.ingest(holdSucceeded);

        // then
        assertThat(result).isEqualTo(WebhookIngestResult.DUPLICATE);
        verify(paymentEventManager, never()).recordFailure(any(), anyString(), any());
    }

    @Test
    @DisplayName("트랜잭션 안에서 중복이 확인되면 DUPLICATE")
    void ingest_DuplicateInsideTransaction() {
        // given
        given(webhookEventRepository.existsByEventId("evt_1")).willReturn(false);
        given(paymentEventManager.apply(holdSucceeded, NOW)).willReturn(WebhookApplication.duplicated());

        // when
        WebhookIngestResult result = service.ingest(holdSucceeded);

        // then
        assertThat(result).isEqualTo(WebhookIngestResult.DUPLICATE);
    }

    @Test
    @DisplayName("동시 변경 충돌은 재전송을 위해 전파한다")
    void ingest_ConcurrencyFailure() {
        // given
        given(webhookEventRepository.existsByEventId("evt_1")).willReturn(false);
        given(paymentEventManager.apply(holdSucceeded, NOW))
                .willThrow(new ObjectOptimisticLockingFailureException("BookingEntity", BOOKING_ID));

        // when & then
        assertThatThrownBy(() -> service.ingest(holdSucceeded))
                .isInstanceOf(ObjectOptimisticLockingFailureException.class);
        verify(paymentEventManager, never()).recordFailure(any(), anyString(), any());
    }

    @Test
    @DisplayName("처리 중 오류는 FAILED로 기록하고 ACCEPTED로 응답한다")
    void ingest_ProcessingFailureAcknowledged() {
        // given
        given(webhookEventRepository.existsByEventId("evt_1")).willReturn(false);
        given(paymentEventManager.apply(holdSucceeded, NOW)).willThrow(new IllegalStateException("boom"));

        // when
        WebhookIngestResult result = service.ingest(holdSucceeded);

        // then
        assertThat(result).isEqualTo(WebhookIngestResult.ACCEPTED);
        verify(paymentEventManager).recordFailure(holdSucceeded, "boom", NOW);
        assertThat(counted("failed")).isEqualTo(1.0);
    }

    @Test
    @DisplayName("종결된 예약에 승인된 홀드는 커밋 후 결제사에서 해제한다")
    void ingest_VoidsStrayHold() {
        // given
        given(webhookEventRepository.existsByEventId("evt_1")).willReturn(false);
        given(paymentEventManager.apply(holdSucceeded, NOW))
                .willReturn(WebhookApplication.strayHold(BOOKING_ID, HOLD_REFERENCE));
        given(paymentGateway.cancelHold(HOLD_REFERENCE, IdempotencyKeys.voidHold(BOOKING_ID, HOLD_REFERENCE)))
                .willReturn(HoldCancellation.cancelled());

        // when
        WebhookIngestResult result = service.ingest(holdSucceeded);

        // then
        assertThat(result).isEqualTo(WebhookIngestResult.ACCEPTED);
        verify(paymentGateway).cancelHold(HOLD_REFERENCE, IdempotencyKeys.voidHold(BOOKING_ID, HOLD_REFERENCE));
        assertThat(counted("discarded")).isEqualTo(1.0);
    }
}
