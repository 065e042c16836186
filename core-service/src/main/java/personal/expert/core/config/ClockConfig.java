package personal.expert.core.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * 시간 의존 로직(홀드 만료, 취소 환불 구간)이 같은 시계를 보도록 Clock을 빈으로 노출한다.
 * 테스트는 고정/가변 Clock으로 교체한다.
 */
@Configuration
public class ClockConfig {

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }
}
