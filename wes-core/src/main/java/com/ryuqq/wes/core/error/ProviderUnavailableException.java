package com.ryuqq.wes.core.error;

/**
 * 일시적 Provider 실패 (타임아웃, rate limit, 인증 토큰 갱신 필요, 네트워크 오류).
 *
 * <p>Run 상태는 유지되고 다음 주기에 재시도됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class ProviderUnavailableException extends ProviderException {

    public ProviderUnavailableException(String message) {
        super(message);
    }

    public ProviderUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public boolean isTransient() {
        return true;
    }
}
