package com.ryuqq.wes.adapter.runner;

/**
 * ReconciliationScheduler 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>queueCapacity: 대기 큐 최대 크기 (기본 1000)</li>
 *   <li>concurrency: 동시 리컨실 워커 수 (기본 10)</li>
 *   <li>reconcileTimeoutMs: 리컨실 패스 하나의 최대 시간 (기본 120000ms = 2분)</li>
 *   <li>shutdownTimeoutMs: stop() 시 진행 중 패스 대기 시간 (기본 30000ms)</li>
 * </ul>
 *
 * <p>reconcileTimeoutMs는 Provider 호출 타임아웃보다 커야 의미가 있습니다.
 * 한 패스는 최대 두 번의 Provider 호출(submit 또는 getStatus, 그리고 cancel)을 포함합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param queueCapacity 큐 크기 (1 이상)
 * @param concurrency 워커 수 (1 이상)
 * @param reconcileTimeoutMs 패스 타임아웃 (밀리초, 양수)
 * @param shutdownTimeoutMs 종료 대기 시간 (밀리초, 0 이상)
 */
public record SchedulerConfig(
    int queueCapacity,
    int concurrency,
    long reconcileTimeoutMs,
    long shutdownTimeoutMs
) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: queueCapacity=1000, concurrency=10, reconcileTimeoutMs=120000ms,
     * shutdownTimeoutMs=30000ms</p>
     */
    public SchedulerConfig() {
        this(1000, 10, 120_000, 30_000);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public SchedulerConfig {
        if (queueCapacity <= 0) {
            throw new IllegalArgumentException(
                "queueCapacity must be positive (current: " + queueCapacity + ")"
            );
        }
        if (concurrency <= 0) {
            throw new IllegalArgumentException(
                "concurrency must be positive (current: " + concurrency + ")"
            );
        }
        if (reconcileTimeoutMs <= 0) {
            throw new IllegalArgumentException(
                "reconcileTimeoutMs must be positive (current: " + reconcileTimeoutMs + ")"
            );
        }
        if (shutdownTimeoutMs < 0) {
            throw new IllegalArgumentException(
                "shutdownTimeoutMs must not be negative (current: " + shutdownTimeoutMs + ")"
            );
        }
    }

    public SchedulerConfig withQueueCapacity(int queueCapacity) {
        return new SchedulerConfig(queueCapacity, concurrency, reconcileTimeoutMs, shutdownTimeoutMs);
    }

    public SchedulerConfig withConcurrency(int concurrency) {
        return new SchedulerConfig(queueCapacity, concurrency, reconcileTimeoutMs, shutdownTimeoutMs);
    }

    public SchedulerConfig withReconcileTimeoutMs(long reconcileTimeoutMs) {
        return new SchedulerConfig(queueCapacity, concurrency, reconcileTimeoutMs, shutdownTimeoutMs);
    }

    public SchedulerConfig withShutdownTimeoutMs(long shutdownTimeoutMs) {
        return new SchedulerConfig(queueCapacity, concurrency, reconcileTimeoutMs, shutdownTimeoutMs);
    }
}
