package personal.expert.core.payment.application.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.List;
import java.util.Locale;

/**
 * Payment 설정 Properties
 * application.yml의 payment.* 설정을 바인딩
 *
 * @param gateway             결제사 어댑터 (stripe | fake)
 * @param supportedCurrencies 허용 통화 (소문자 ISO 코드)
 * @param stripe              Stripe 연동 설정
 */
@ConfigurationProperties(prefix = "payment")
public record PaymentProperties(
        String gateway,
        List<String> supportedCurrencies,
        Stripe stripe
) {
    public boolean supports(String currency) {
        return currency != null && supportedCurrencies.contains(currency.toLowerCase(Locale.ROOT));
    }

    /**
     * @param apiKey                  비밀 API 키
     * @param webhookSecret           Webhook 서명 검증 비밀 값
     * @param webhookToleranceSeconds 서명 timestamp 허용 오차
     * @param apiBase                 API 기본 URL (비어 있으면 Stripe 기본값)
     */
    public record Stripe(
            String apiKey,
            String webhookSecret,
            long webhookToleranceSeconds,
            String apiBase
    ) {}
}
