package personal.expert.core.payment.application.port.in;

/**
 * Ingest Webhook Command
 *
 * @param payload         원본 요청 본문 (서명 검증 대상이므로 변형하지 않는다)
 * @param signatureHeader 결제사 서명 헤더
 */
public record IngestWebhookCommand(
        String payload,
        String signatureHeader
) {
}
