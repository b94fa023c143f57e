package com.ryuqq.wes.core.error;

/**
 * Run Store 또는 lock 저장소를 사용할 수 없는 경우 (EngineFault).
 *
 * <p>리컨실 패스는 상태 변경 없이 중단되고 다음 주기에 재시도됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class RunStoreException extends RuntimeException {

    public RunStoreException(String message) {
        super(message);
    }

    public RunStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
