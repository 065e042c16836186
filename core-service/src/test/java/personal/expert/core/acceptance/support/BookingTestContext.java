package personal.expert.core.acceptance.support;

import io.cucumber.spring.ScenarioScope;
import io.restassured.response.Response;
import lombok.Getter;
import lombok.Setter;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Booking Acceptance Test Context
 * 시나리오 간 상태 공유를 위한 컨텍스트 클래스
 *
 * @ScenarioScope: Cucumber 시나리오당 하나의 인스턴스 생성
 */
@Getter
@Setter
@Component
@ScenarioScope
public class BookingTestContext {

    /** 기본 학습자 ID */
    public static final Long LEARNER_ID = 10L;

    /** 기본 전문가 ID */
    public static final Long EXPERT_ID = 20L;

    // ==========================================
    // 동시성 테스트용
    // ==========================================
    private final AtomicInteger successfulReservations = new AtomicInteger(0);
    private final AtomicInteger failedReservations = new AtomicInteger(0);

    /** 마지막 HTTP API 응답 (모든 Step에서 공유) */
    private Response lastHttpResponse;

    private Long currentSessionId;
    private Long currentSlotId;
    private Long currentBookingId;
    private String currentHoldReference;

    /** 마지막으로 보낸 Webhook 본문 (재전송 테스트용) */
    private String lastWebhookPayload;
}
