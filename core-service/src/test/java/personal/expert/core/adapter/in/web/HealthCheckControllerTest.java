package personal.expert.core.adapter.in.web;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import personal.expert.common.health.HealthCheckService;

import javax.sql.DataSource;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.BDDMockito.given;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Health Check Controller 단위 테스트
 * @WebMvcTest를 사용하여 컨트롤러 계층만 테스트
 */
@WebMvcTest(HealthCheckController.class)
@DisplayName("Health Check API 단위 테스트")
class HealthCheckControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private DataSource dataSource;

    @MockBean
    private HealthCheckService healthCheckService;

    @Test
    @DisplayName("헬스 체크 API는 정상 응답을 반환한다")
    void healthCheckReturnsSuccess() throws Exception {
        // Given: DB, Kafka가 정상 동작 중
        given(healthCheckService.checkDatabase(any(DataSource.class))).willReturn("UP");
        given(healthCheckService.checkKafka()).willReturn("UP");

        // When & Then
        mockMvc.perform(get("/api/v1/health")
                        .contentType(MediaType.APPLICATION_JSON))
                .andExpect(status().isOk())
                .andExpect(content().contentType(MediaType.APPLICATION_JSON))
                .andExpect(jsonPath("$.result").value("success"))
                .andExpect(jsonPath("$.data.database").value("UP"))
                .andExpect(jsonPath("$.data.kafka").value("UP"));
    }

    @Test
    @DisplayName("Kafka가 내려가 있으면 error 결과와 함께 상태를 알려준다")
    void healthCheckReportsUnhealthyComponent() throws Exception {
        // Given: Kafka 장애
        given(healthCheckService.checkDatabase(any(DataSource.class))).willReturn("UP");
        given(healthCheckService.checkKafka()).willReturn("DOWN");

        // When & Then
        mockMvc.perform(get("/api/v1/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.result").value("error"))
                .andExpect(jsonPath("$.message").isString())
                .andExpect(jsonPath("$.data.kafka").value("DOWN"));
    }
}
