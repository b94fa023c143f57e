package com.ryuqq.wes.daemon;

import com.ryuqq.wes.adapter.notification.NotificationConfig;
import com.ryuqq.wes.adapter.provider.ArvadosConfig;
import com.ryuqq.wes.adapter.provider.SevenBridgesConfig;
import com.ryuqq.wes.adapter.runner.PollerConfig;
import com.ryuqq.wes.adapter.runner.SchedulerConfig;
import com.ryuqq.wes.application.lifecycle.LifecycleConfig;

import java.net.URI;
import java.time.Duration;
import java.util.Optional;
import java.util.function.Function;

/**
 * 데몬 전체 설정 (불변 record).
 *
 * <p>환경 변수는 {@link #fromEnv(Function)}에서 한 번만 읽고, 이후에는 모듈별 설정 record로 변환해서 전달합니다.</p>
 *
 * <p><strong>환경 변수:</strong></p>
 * <pre>
 * DAEMON_POLL_INTERVAL              폴링 주기 (초, 기본 300)
 * DAEMON_STATUS_CHECK_INTERVAL      상태 재확인 기준 (초, 기본 300)
 * DAEMON_MAX_CONCURRENT_WORKFLOWS   동시 활성 Run 수 (기본 10)
 * DAEMON_WORKER_THREADS             리컨실 워커 수 (기본 10)
 * DAEMON_PROVIDER_TIMEOUT           Provider 호출 타임아웃 (초, 기본 30)
 * DAEMON_NOTIFICATION_HOST          알림 서버 호스트 (기본 localhost)
 * DAEMON_NOTIFICATION_PORT          알림 서버 포트 (기본 5001)
 * WES_DEFAULT_PROVIDER              기본 Provider 키 (선택)
 * SEVENBRIDGES_API_TOKEN / SEVENBRIDGES_API_ENDPOINT / SEVENBRIDGES_PROJECT
 * ARVADOS_API_HOST / ARVADOS_API_TOKEN / ARVADOS_PROJECT_UUID
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param pollIntervalSeconds 폴링 주기 (초)
 * @param statusCheckIntervalSeconds 상태 재확인 기준 (초)
 * @param maxConcurrentWorkflows 동시 활성 Run 수
 * @param workerThreads 리컨실 워커 수
 * @param providerTimeoutSeconds Provider 호출 타임아웃 (초)
 * @param notificationHost 알림 서버 호스트
 * @param notificationPort 알림 서버 포트
 * @param defaultProvider 기본 Provider 키 (nullable)
 * @param sevenBridges Seven Bridges 설정 (자격 증명이 없으면 null)
 * @param arvados Arvados 설정 (자격 증명이 없으면 null)
 */
public record EngineSettings(
    long pollIntervalSeconds,
    long statusCheckIntervalSeconds,
    int maxConcurrentWorkflows,
    int workerThreads,
    long providerTimeoutSeconds,
    String notificationHost,
    int notificationPort,
    String defaultProvider,
    SevenBridgesConfig sevenBridges,
    ArvadosConfig arvados
) {

    private static final long MIN_RECONCILE_TIMEOUT_MS = 120_000;

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public EngineSettings {
        if (pollIntervalSeconds <= 0) {
            throw new IllegalArgumentException(
                "pollIntervalSeconds must be positive (current: " + pollIntervalSeconds + ")"
            );
        }
        if (statusCheckIntervalSeconds <= 0) {
            throw new IllegalArgumentException(
                "statusCheckIntervalSeconds must be positive (current: " + statusCheckIntervalSeconds + ")"
            );
        }
        if (providerTimeoutSeconds <= 0) {
            throw new IllegalArgumentException(
                "providerTimeoutSeconds must be positive (current: " + providerTimeoutSeconds + ")"
            );
        }
        if (defaultProvider != null && defaultProvider.isBlank()) {
            defaultProvider = null;
        }
    }

    /**
     * 환경 변수에서 설정을 읽습니다.
     *
     * @param env 변수 조회 함수 (예: {@code System::getenv})
     * @return 설정
     * @throws IllegalArgumentException 값의 형식이 잘못되었거나 Provider 자격 증명이 불완전한 경우
     */
    public static EngineSettings fromEnv(Function<String, String> env) {
        if (env == null) {
            throw new IllegalArgumentException("env cannot be null");
        }
        return new EngineSettings(
            longValue(env, "DAEMON_POLL_INTERVAL", 300),
            longValue(env, "DAEMON_STATUS_CHECK_INTERVAL", 300),
            (int) longValue(env, "DAEMON_MAX_CONCURRENT_WORKFLOWS", 10),
            (int) longValue(env, "DAEMON_WORKER_THREADS", 10),
            longValue(env, "DAEMON_PROVIDER_TIMEOUT", 30),
            stringValue(env, "DAEMON_NOTIFICATION_HOST", "localhost"),
            (int) longValue(env, "DAEMON_NOTIFICATION_PORT", 5001),
            stringValue(env, "WES_DEFAULT_PROVIDER", null),
            sevenBridges(env),
            arvados(env)
        );
    }

    // ============================================================
    // Module configs
    // ============================================================

    public LifecycleConfig lifecycleConfig() {
        return new LifecycleConfig().withDefaultProviderType(defaultProvider);
    }

    /**
     * 리컨실 패스 타임아웃은 Provider 호출 타임아웃보다 충분히 길게 잡습니다 (패스 하나에 호출이 최대 두 번).
     */
    public SchedulerConfig schedulerConfig() {
        long reconcileTimeoutMs = Math.max(MIN_RECONCILE_TIMEOUT_MS, providerCallTimeout().toMillis() * 3);
        return new SchedulerConfig()
            .withConcurrency(workerThreads)
            .withReconcileTimeoutMs(reconcileTimeoutMs);
    }

    public PollerConfig pollerConfig() {
        return new PollerConfig()
            .withScanIntervalMs(pollIntervalSeconds * 1000)
            .withStaleThresholdMs(statusCheckIntervalSeconds * 1000)
            .withMaxActiveRuns(maxConcurrentWorkflows);
    }

    public NotificationConfig notificationConfig() {
        return new NotificationConfig().withHost(notificationHost).withPort(notificationPort);
    }

    public Duration providerCallTimeout() {
        return Duration.ofSeconds(providerTimeoutSeconds);
    }

    public Optional<SevenBridgesConfig> sevenBridgesConfig() {
        return Optional.ofNullable(sevenBridges);
    }

    public Optional<ArvadosConfig> arvadosConfig() {
        return Optional.ofNullable(arvados);
    }

    // ============================================================
    // Parsing
    // ============================================================

    private static SevenBridgesConfig sevenBridges(Function<String, String> env) {
        String token = stringValue(env, "SEVENBRIDGES_API_TOKEN", null);
        if (token == null) {
            return null;
        }
        String project = stringValue(env, "SEVENBRIDGES_PROJECT", null);
        if (project == null) {
            throw new IllegalArgumentException("SEVENBRIDGES_PROJECT must be set when SEVENBRIDGES_API_TOKEN is set");
        }
        String endpoint = stringValue(env, "SEVENBRIDGES_API_ENDPOINT", SevenBridgesConfig.DEFAULT_ENDPOINT.toString());
        return new SevenBridgesConfig(token, project).withApiEndpoint(URI.create(endpoint));
    }

    private static ArvadosConfig arvados(Function<String, String> env) {
        String host = stringValue(env, "ARVADOS_API_HOST", null);
        String token = stringValue(env, "ARVADOS_API_TOKEN", null);
        String project = stringValue(env, "ARVADOS_PROJECT_UUID", null);
        if (host == null && token == null) {
            return null;
        }
        if (host == null || token == null || project == null) {
            throw new IllegalArgumentException(
                "ARVADOS_API_HOST, ARVADOS_API_TOKEN and ARVADOS_PROJECT_UUID must all be set to enable Arvados"
            );
        }
        return new ArvadosConfig(host, token, project);
    }

    private static String stringValue(Function<String, String> env, String name, String defaultValue) {
        String value = env.apply(name);
        return value == null || value.isBlank() ? defaultValue : value.trim();
    }

    private static long longValue(Function<String, String> env, String name, long defaultValue) {
        String value = stringValue(env, name, null);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(name + " must be an integer (current: " + value + ")", e);
        }
    }

    @Override
    public String toString() {
        return "EngineSettings[pollInterval=" + pollIntervalSeconds + "s"
            + ", statusCheckInterval=" + statusCheckIntervalSeconds + "s"
            + ", maxConcurrentWorkflows=" + maxConcurrentWorkflows
            + ", workerThreads=" + workerThreads
            + ", providerTimeout=" + providerTimeoutSeconds + "s"
            + ", notification=" + notificationHost + ":" + notificationPort
            + ", defaultProvider=" + defaultProvider
            + ", sevenBridges=" + (sevenBridges != null)
            + ", arvados=" + (arvados != null) + "]";
    }
}
