package personal.expert.common.exception;

import java.time.LocalDateTime;

/**
 * 에러 응답 포맷
 */
public record ErrorResponse(
        String code,
        String message,
        LocalDateTime timestamp) {

    public static ErrorResponse of(ErrorCode errorCode, String message) {
        return new ErrorResponse(errorCode.getCode(), message, LocalDateTime.now());
    }
}
