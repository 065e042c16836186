package personal.expert.common.dto;

/**
 * 공통 API 응답 포맷
 *
 * @param result  "success" 또는 "error"
 * @param message 응답 메시지
 * @param data    응답 데이터
 */
public record ApiResponse<T>(
        String result,
        String message,
        T data) {

    public static <T> ApiResponse<T> success(String message, T data) {
        return new ApiResponse<>("success", message, data);
    }

    public static <T> ApiResponse<T> error(String message, T data) {
        return new ApiResponse<>("error", message, data);
    }
}
