package personal.expert.core.booking.adapter.in.web;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import personal.expert.core.booking.adapter.in.web.dto.SweepResponse;
import personal.expert.core.booking.application.config.BookingProperties;
import personal.expert.core.booking.application.port.in.SweepExpiredBookingsUseCase;
import personal.expert.core.booking.application.port.in.SweepResult;
import personal.expert.core.booking.domain.exception.SweepUnauthorizedException;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.time.Clock;
import java.time.LocalDateTime;

/**
 * Internal Sweep Controller
 * 외부 스케줄러(cron)가 호출하는 만료 정리 트리거. Bearer 비밀 값으로 보호된다.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/internal")
@RequiredArgsConstructor
public class BookingSweepController {

    private static final String BEARER_PREFIX = "Bearer ";

    private final SweepExpiredBookingsUseCase sweepExpiredBookingsUseCase;
    private final BookingProperties bookingProperties;
    private final Clock clock;

    /**
     * POST /api/v1/internal/bookings/sweep
     */
    @PostMapping("/bookings/sweep")
    public ResponseEntity<SweepResponse> sweep(
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization
    ) {
        if (!isAuthorized(authorization)) {
            log.warn("SECURITY: Unauthorized sweep request");
            throw new SweepUnauthorizedException();
        }

        SweepResult result = sweepExpiredBookingsUseCase.sweep(LocalDateTime.now(clock));
        return ResponseEntity.ok(SweepResponse.from(result));
    }

    private boolean isAuthorized(String authorization) {
        String secret = bookingProperties.sweep().secret();
        if (secret == null || secret.isBlank() || authorization == null || !authorization.startsWith(BEARER_PREFIX)) {
            return false;
        }
        byte[] presented = authorization.substring(BEARER_PREFIX.length()).getBytes(StandardCharsets.UTF_8);
        return MessageDigest.isEqual(presented, secret.getBytes(StandardCharsets.UTF_8));
    }
}
