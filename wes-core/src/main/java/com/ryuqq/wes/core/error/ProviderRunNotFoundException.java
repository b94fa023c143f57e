package com.ryuqq.wes.core.error;

/**
 * Provider가 external handle을 인식하지 못하는 경우.
 *
 * <p>"not found"는 일시적 실패가 아닌 영구적 분류입니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class ProviderRunNotFoundException extends ProviderException {

    private final String externalHandle;

    public ProviderRunNotFoundException(String externalHandle) {
        super("Provider has no run with handle: " + externalHandle);
        this.externalHandle = externalHandle;
    }

    public String getExternalHandle() {
        return externalHandle;
    }

    @Override
    public boolean isTransient() {
        return false;
    }
}
