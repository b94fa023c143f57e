package com.ryuqq.wes.adapter.runner;

/**
 * StaleRunPoller 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>scanIntervalMs: 스캔 간격 (기본 300000ms = 5분)</li>
 *   <li>staleThresholdMs: 이 시간 이상 리컨실되지 않은 Run을 다시 큐에 넣음 (기본 300000ms = 5분)</li>
 *   <li>batchSize: 스캔당 최대 Run 수 (기본 100)</li>
 *   <li>maxActiveRuns: 동시에 Provider에서 실행 중일 수 있는 Run 수 (기본 10)</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param scanIntervalMs 스캔 간격 (밀리초, 양수)
 * @param staleThresholdMs stale 판단 기준 (밀리초, 0 이상)
 * @param batchSize 배치 크기 (1 이상)
 * @param maxActiveRuns 활성 Run 상한 (1 이상)
 */
public record PollerConfig(
    long scanIntervalMs,
    long staleThresholdMs,
    int batchSize,
    int maxActiveRuns
) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: scanIntervalMs=300000ms, staleThresholdMs=300000ms, batchSize=100, maxActiveRuns=10</p>
     */
    public PollerConfig() {
        this(300_000, 300_000, 100, 10);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public PollerConfig {
        if (scanIntervalMs <= 0) {
            throw new IllegalArgumentException(
                "scanIntervalMs must be positive (current: " + scanIntervalMs + ")"
            );
        }
        if (staleThresholdMs < 0) {
            throw new IllegalArgumentException(
                "staleThresholdMs must not be negative (current: " + staleThresholdMs + ")"
            );
        }
        if (batchSize <= 0) {
            throw new IllegalArgumentException(
                "batchSize must be positive (current: " + batchSize + ")"
            );
        }
        if (maxActiveRuns <= 0) {
            throw new IllegalArgumentException(
                "maxActiveRuns must be positive (current: " + maxActiveRuns + ")"
            );
        }
    }

    public PollerConfig withScanIntervalMs(long scanIntervalMs) {
        return new PollerConfig(scanIntervalMs, staleThresholdMs, batchSize, maxActiveRuns);
    }

    public PollerConfig withStaleThresholdMs(long staleThresholdMs) {
        return new PollerConfig(scanIntervalMs, staleThresholdMs, batchSize, maxActiveRuns);
    }

    public PollerConfig withBatchSize(int batchSize) {
        return new PollerConfig(scanIntervalMs, staleThresholdMs, batchSize, maxActiveRuns);
    }

    public PollerConfig withMaxActiveRuns(int maxActiveRuns) {
        return new PollerConfig(scanIntervalMs, staleThresholdMs, batchSize, maxActiveRuns);
    }
}
