package personal.expert.core;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Expert Booking Application
 * 전문가 세션 예약과 결제(홀드 → 승인 시 캡처) 오케스트레이션 서비스
 */
@EnableScheduling            // Outbox, Reaper Scheduler 활성화
@ConfigurationPropertiesScan // booking.*, payment.* Properties 바인딩
@SpringBootApplication(
    scanBasePackages = {
        "personal.expert.core",
        "personal.expert.common"  // common 모듈의 GlobalExceptionHandler 등을 스캔
    }
)
public class ExpertBookingApplication {
    public static void main(String[] args) {
        SpringApplication.run(ExpertBookingApplication.class, args);
    }
}
