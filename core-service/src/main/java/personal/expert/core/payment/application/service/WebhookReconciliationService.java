package personal.expert.core.payment.application.service;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import personal.expert.core.payment.application.port.in.IngestWebhookCommand;
import personal.expert.core.payment.application.port.in.IngestWebhookUseCase;
import personal.expert.core.payment.application.port.out.PaymentEventVerifier;
import personal.expert.core.payment.application.port.out.PaymentGateway;
import personal.expert.core.payment.application.port.out.WebhookEventRepository;
import personal.expert.core.payment.domain.exception.ExternalProcessorException;
import personal.expert.core.payment.domain.exception.InvalidWebhookSignatureException;
import personal.expert.core.payment.domain.model.IdempotencyKeys;
import personal.expert.core.payment.domain.model.PaymentEvent;
import personal.expert.core.payment.domain.model.WebhookApplication;
import personal.expert.core.payment.domain.model.WebhookIngestResult;
import personal.expert.core.payment.domain.service.PaymentEventManager;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Locale;

/**
 * Webhook Reconciliation Service (Webhook Reconciler)
 * <p>
 * 1. 서명 검증 (실패 시 어떤 상태도 변경하지 않고 400)
 * 2. event_id 중복 제거 (원장 조회 + 유니크 제약)
 * 3. 상태 반영 + 원장 기록 (Tx)
 * 4. 종결된 예약에 승인된 홀드 해제 (No Tx)
 * <p>
 * 처리 중 오류는 FAILED로 기록하고 수신 성공으로 응답한다 (결제사 재전송 폭주 방지).
 * 단, 동시 변경 충돌은 재전송으로 다시 처리되도록 예외를 전파한다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class WebhookReconciliationService implements IngestWebhookUseCase {

    private final PaymentEventVerifier paymentEventVerifier;
    private final PaymentEventManager paymentEventManager;
    private final WebhookEventRepository webhookEventRepository;
    private final PaymentGateway paymentGateway;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    @Override
    public WebhookIngestResult ingest(IngestWebhookCommand command) {
        PaymentEvent event;
        try {
            event = paymentEventVerifier.verify(command.payload(), command.signatureHeader());
        } catch (InvalidWebhookSignatureException e) {
            log.warn("SECURITY: Webhook signature verification failed: {}", e.getMessage());
            count("rejected");
            throw e;
        }
        return ingest(event);
    }

    @Override
    public WebhookIngestResult ingest(PaymentEvent event) {
        // Fast path: 이미 기록된 이벤트
        if (webhookEventRepository.existsByEventId(event.eventId())) {
            log.info("Duplicate webhook ignored: eventId={}, type={}", event.eventId(), event.rawType());
            count("duplicate");
            return WebhookIngestResult.DUPLICATE;
        }

        WebhookApplication application;
        try {
            application = paymentEventManager.apply(event, now());
        } catch (DataIntegrityViolationException e) {
            log.info("Duplicate webhook detected on ledger insert: eventId={}", event.eventId());
            count("duplicate");
            return WebhookIngestResult.DUPLICATE;
        } catch (ConcurrencyFailureException e) {
            log.warn("Webhook conflicted with concurrent update, awaiting redelivery: eventId={}", event.eventId());
            throw e;
        } catch (RuntimeException e) {
            log.error("Webhook processing failed: eventId={}, type={}, bookingId={}",
                    event.eventId(), event.rawType(), event.bookingId(), e);
            return recordFailure(event, e);
        }

        if (application.duplicate()) {
            log.info("Duplicate webhook ignored: eventId={}", event.eventId());
            count("duplicate");
            return WebhookIngestResult.DUPLICATE;
        }
        if (application.hasStrayHold()) {
            voidStrayHold(application);
        }

        count(application.outcome().name().toLowerCase(Locale.ROOT));
        return WebhookIngestResult.ACCEPTED;
    }

    private WebhookIngestResult recordFailure(PaymentEvent event, RuntimeException cause) {
        try {
            paymentEventManager.recordFailure(event, cause.getMessage(), now());
        } catch (DataIntegrityViolationException e) {
            log.info("Webhook already recorded by a concurrent delivery: eventId={}", event.eventId());
            return WebhookIngestResult.DUPLICATE;
        }
        count("failed");
        return WebhookIngestResult.ACCEPTED;
    }

    private void voidStrayHold(WebhookApplication application) {
        String holdReference = application.strayHoldReference();
        try {
            paymentGateway.cancelHold(holdReference, IdempotencyKeys.voidHold(application.bookingId(), holdReference));
            log.info("Stray hold voided: bookingId={}, holdReference={}",
                    application.bookingId(), application.strayHoldReference());
        } catch (ExternalProcessorException e) {
            log.error("Failed to void stray hold, manual follow-up required: bookingId={}, holdReference={}",
                    application.bookingId(), application.strayHoldReference(), e);
        }
    }

    private void count(String outcome) {
        Counter.builder("payment.webhook.events")
                .tag("outcome", outcome)
                .description("Number of processed payment webhook events")
                .register(meterRegistry)
                .increment();
    }

    private LocalDateTime now() {
        return LocalDateTime.now(clock);
    }
}
