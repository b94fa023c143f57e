package com.ryuqq.wes.core.error;

/**
 * Provider 호출 실패의 공통 상위 타입.
 *
 * <p>Lifecycle Controller는 하위 타입으로 실패를 분류합니다:</p>
 * <ul>
 *   <li>{@link ProviderUnavailableException}: 일시적 실패 (재시도 대상)</li>
 *   <li>{@link ProviderSubmissionException}: 영구적 제출 거부</li>
 *   <li>{@link ProviderRunNotFoundException}: Provider가 handle을 모름 (영구적)</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public abstract class ProviderException extends Exception {

    protected ProviderException(String message) {
        super(message);
    }

    protected ProviderException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * 재시도로 회복 가능한 실패인지 여부.
     *
     * @return 일시적 실패인 경우 true
     */
    public abstract boolean isTransient();
}
