package com.ryuqq.wes.adapter.provider;

import java.net.URI;

/**
 * Arvados 어댑터 설정 (불변 record).
 *
 * <p>apiHost에 스킴이 없으면 https로 접속합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param apiHost API 호스트 (예: zzzzz.arvadosapi.com)
 * @param apiToken API 토큰
 * @param projectUuid Container Request를 소유할 프로젝트 UUID
 * @param requestTimeoutMs HTTP 요청 타임아웃 (밀리초)
 */
public record ArvadosConfig(
    String apiHost,
    String apiToken,
    String projectUuid,
    long requestTimeoutMs
) {

    public ArvadosConfig(String apiHost, String apiToken, String projectUuid) {
        this(apiHost, apiToken, projectUuid, 20_000);
    }

    public ArvadosConfig {
        if (apiHost == null || apiHost.isBlank()) {
            throw new IllegalArgumentException("apiHost cannot be null or blank");
        }
        if (apiToken == null || apiToken.isBlank()) {
            throw new IllegalArgumentException("apiToken cannot be null or blank");
        }
        if (projectUuid == null || projectUuid.isBlank()) {
            throw new IllegalArgumentException("projectUuid cannot be null or blank");
        }
        if (requestTimeoutMs <= 0) {
            throw new IllegalArgumentException("requestTimeoutMs must be positive (current: " + requestTimeoutMs + ")");
        }
    }

    /**
     * API 기본 URL.
     *
     * @return 스킴이 포함된 URL (끝의 '/' 제거)
     */
    public URI baseUri() {
        String base = apiHost.contains("://") ? apiHost : "https://" + apiHost;
        return URI.create(base.endsWith("/") ? base.substring(0, base.length() - 1) : base);
    }

    public ArvadosConfig withRequestTimeoutMs(long requestTimeoutMs) {
        return new ArvadosConfig(apiHost, apiToken, projectUuid, requestTimeoutMs);
    }

    @Override
    public String toString() {
        return "ArvadosConfig[apiHost=" + apiHost + ", projectUuid=" + projectUuid
            + ", requestTimeoutMs=" + requestTimeoutMs + "]";
    }
}
