package personal.expert.core.payment.adapter.in.web.dto;

import personal.expert.core.payment.domain.model.WebhookIngestResult;

/**
 * Webhook 수신 응답 DTO
 */
public record WebhookReceiptResponse(
        boolean received,
        boolean duplicate
) {
    public static WebhookReceiptResponse from(WebhookIngestResult result) {
        return new WebhookReceiptResponse(true, result.isDuplicate());
    }
}
