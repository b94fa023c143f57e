package com.ryuqq.wes.core.error;

/**
 * 해석할 수 없는 page token.
 *
 * <p>첫 페이지로 조용히 초기화하지 않고 호출을 실패시킵니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class InvalidPageTokenException extends IllegalArgumentException {

    public InvalidPageTokenException(String message) {
        super(message);
    }

    public InvalidPageTokenException(String message, Throwable cause) {
        super(message, cause);
    }
}
