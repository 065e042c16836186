package personal.expert.core.acceptance.support;

import io.cucumber.spring.CucumberContextConfiguration;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;

/**
 * Cucumber와 Spring Boot를 통합하기 위한 설정 클래스
 * H2(MySQL 모드)와 Fake 결제사로 실제 HTTP 서버를 띄워 테스트
 */
@CucumberContextConfiguration
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
@ActiveProfiles("test")
@Import({BookingTestAdapter.class, BookingHttpAdapter.class, BookingTestContext.class})
public class CucumberSpringConfiguration {
}
