package com.ryuqq.wes.adapter.provider;

import java.net.URI;

/**
 * Seven Bridges 어댑터 설정 (불변 record).
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param apiEndpoint API 기본 URL (기본 https://api.sbgenomics.com/v2)
 * @param apiToken 인증 토큰 ({@code X-SBG-Auth-Token})
 * @param project 태스크를 만들 프로젝트 ID
 * @param requestTimeoutMs HTTP 요청 타임아웃 (밀리초)
 */
public record SevenBridgesConfig(
    URI apiEndpoint,
    String apiToken,
    String project,
    long requestTimeoutMs
) {

    public static final URI DEFAULT_ENDPOINT = URI.create("https://api.sbgenomics.com/v2");

    public SevenBridgesConfig(String apiToken, String project) {
        this(DEFAULT_ENDPOINT, apiToken, project, 20_000);
    }

    public SevenBridgesConfig {
        if (apiEndpoint == null) {
            throw new IllegalArgumentException("apiEndpoint cannot be null");
        }
        if (apiToken == null || apiToken.isBlank()) {
            throw new IllegalArgumentException("apiToken cannot be null or blank");
        }
        if (project == null || project.isBlank()) {
            throw new IllegalArgumentException("project cannot be null or blank");
        }
        if (requestTimeoutMs <= 0) {
            throw new IllegalArgumentException("requestTimeoutMs must be positive (current: " + requestTimeoutMs + ")");
        }
        String endpoint = apiEndpoint.toString();
        if (endpoint.endsWith("/")) {
            apiEndpoint = URI.create(endpoint.substring(0, endpoint.length() - 1));
        }
    }

    public SevenBridgesConfig withApiEndpoint(URI apiEndpoint) {
        return new SevenBridgesConfig(apiEndpoint, apiToken, project, requestTimeoutMs);
    }

    public SevenBridgesConfig withRequestTimeoutMs(long requestTimeoutMs) {
        return new SevenBridgesConfig(apiEndpoint, apiToken, project, requestTimeoutMs);
    }

    @Override
    public String toString() {
        return "SevenBridgesConfig[apiEndpoint=" + apiEndpoint + ", project=" + project
            + ", requestTimeoutMs=" + requestTimeoutMs + "]";
    }
}
