package personal.expert.common.dto;

/**
 * Health Check 응답 데이터
 *
 * @param database 데이터베이스 상태 (UP/DOWN)
 * @param kafka    Kafka 상태 (UP/DOWN)
 */
public record HealthCheckResponse(
        String database,
        String kafka) {
}
