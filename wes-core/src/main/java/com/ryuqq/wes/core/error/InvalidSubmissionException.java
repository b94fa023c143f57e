package com.ryuqq.wes.core.error;

/**
 * 잘못된 제출 요청 (CallerError).
 *
 * <p>Run이 생성되기 전에 거부되며 아무것도 저장되지 않습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class InvalidSubmissionException extends IllegalArgumentException {

    public InvalidSubmissionException(String message) {
        super(message);
    }
}
