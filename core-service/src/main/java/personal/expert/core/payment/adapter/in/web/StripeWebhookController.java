package personal.expert.core.payment.adapter.in.web;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import personal.expert.core.payment.adapter.in.web.dto.WebhookReceiptResponse;
import personal.expert.core.payment.application.port.in.IngestWebhookCommand;
import personal.expert.core.payment.application.port.in.IngestWebhookUseCase;
import personal.expert.core.payment.domain.model.WebhookIngestResult;

/**
 * Stripe Webhook Controller
 * 서명 검증을 위해 본문을 가공하지 않은 문자열 그대로 전달한다.
 * 중복 이벤트도 200으로 응답하여 결제사 재전송을 멈춘다.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/webhooks")
@RequiredArgsConstructor
public class StripeWebhookController {

    private static final String SIGNATURE_HEADER = "Stripe-Signature";

    private final IngestWebhookUseCase ingestWebhookUseCase;

    /**
     * POST /api/v1/webhooks/stripe
     */
    @PostMapping("/stripe")
    public ResponseEntity<WebhookReceiptResponse> receive(
            @RequestBody String payload,
            @RequestHeader(value = SIGNATURE_HEADER, required = false) String signature
    ) {
        log.debug("Stripe webhook received: bytes={}", payload.length());

        WebhookIngestResult result = ingestWebhookUseCase.ingest(new IngestWebhookCommand(payload, signature));

        return ResponseEntity.ok(WebhookReceiptResponse.from(result));
    }
}
