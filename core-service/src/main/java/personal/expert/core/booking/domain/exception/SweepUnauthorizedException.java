package personal.expert.core.booking.domain.exception;

import personal.expert.common.exception.BusinessException;
import personal.expert.common.exception.ErrorCode;

/**
 * Sweep Unauthorized Exception
 * 만료 정리 트리거 인증 실패
 */
public class SweepUnauthorizedException extends BusinessException {
    public SweepUnauthorizedException() {
        super(ErrorCode.UNAUTHORIZED,
                "Sweep trigger rejected: missing or invalid credential");
    }
}
