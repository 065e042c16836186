package personal.expert.core.booking.domain.exception;

import personal.expert.common.exception.BusinessException;
import personal.expert.common.exception.ErrorCode;

/**
 * Session Not Found Exception
 * 세션을 찾을 수 없을 때 발생
 */
public class SessionNotFoundException extends BusinessException {
    public SessionNotFoundException(Long sessionId) {
        super(ErrorCode.SESSION_NOT_FOUND,
                String.format("Session not found: sessionId=%d", sessionId));
    }
}
