package com.ryuqq.wes.core.error;

/**
 * 등록되지 않은 provider type이 요청된 경우.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class UnknownProviderException extends IllegalArgumentException {

    private final String providerType;

    public UnknownProviderException(String providerType) {
        super("Unknown provider type: " + providerType);
        this.providerType = providerType;
    }

    public String getProviderType() {
        return providerType;
    }
}
