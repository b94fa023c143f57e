package com.ryuqq.wes.core.error;

/**
 * Provider가 워크플로우 또는 제출 파라미터를 거부한 영구적 실패.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class ProviderSubmissionException extends ProviderException {

    public ProviderSubmissionException(String message) {
        super(message);
    }

    public ProviderSubmissionException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public boolean isTransient() {
        return false;
    }
}
