package com.ryuqq.wes.application.lifecycle;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * 일시적 Provider 실패 후 다음 호출까지의 대기 시간 계산기.
 *
 * <p>연속 실패 횟수에 따라 지수적으로 늘어나며, 여러 Run이 같은 순간에
 * Provider로 몰리지 않도록 jitter를 더합니다.</p>
 *
 * <pre>
 * delay = min(baseDelay * 2^(failures-1) + jitter, maxDelay)
 * jitter = random(0, exponential * jitterFactor)
 * </pre>
 *
 * <p>예 (baseDelay=30s, maxDelay=10m): 1회 30s, 2회 60s, 3회 120s, 6회 이후 10m</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class BackoffCalculator {

    private final long baseDelayMs;
    private final long maxDelayMs;
    private final double jitterFactor;
    private final DoubleSupplier random;

    /**
     * 기본 설정으로 생성.
     *
     * <p>기본값: baseDelay=30000ms, maxDelay=600000ms, jitterFactor=0.1</p>
     */
    public BackoffCalculator() {
        this(30_000, 600_000, 0.1);
    }

    /**
     * 커스텀 설정으로 생성.
     *
     * @param baseDelayMs 첫 실패 후 대기 시간 (밀리초, 양수여야 함)
     * @param maxDelayMs 최대 대기 시간 (밀리초, baseDelayMs 이상이어야 함)
     * @param jitterFactor Jitter 비율 (0.0 ~ 1.0)
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public BackoffCalculator(long baseDelayMs, long maxDelayMs, double jitterFactor) {
        this(baseDelayMs, maxDelayMs, jitterFactor, () -> ThreadLocalRandom.current().nextDouble());
    }

    BackoffCalculator(long baseDelayMs, long maxDelayMs, double jitterFactor, DoubleSupplier random) {
        if (baseDelayMs <= 0) {
            throw new IllegalArgumentException(
                "baseDelayMs must be positive (current: " + baseDelayMs + ")"
            );
        }
        if (maxDelayMs < baseDelayMs) {
            throw new IllegalArgumentException(
                "maxDelayMs must be >= baseDelayMs (base: " + baseDelayMs + ", max: " + maxDelayMs + ")"
            );
        }
        if (jitterFactor < 0.0 || jitterFactor > 1.0) {
            throw new IllegalArgumentException(
                "jitterFactor must be between 0.0 and 1.0 (current: " + jitterFactor + ")"
            );
        }
        if (random == null) {
            throw new IllegalArgumentException("random cannot be null");
        }
        this.baseDelayMs = baseDelayMs;
        this.maxDelayMs = maxDelayMs;
        this.jitterFactor = jitterFactor;
        this.random = random;
    }

    /**
     * 연속 실패 횟수에 대한 대기 시간.
     *
     * @param consecutiveFailures 연속 실패 횟수 (1부터 시작)
     * @return 다음 Provider 호출까지 대기 시간
     * @throws IllegalArgumentException consecutiveFailures가 양수가 아닌 경우
     */
    public Duration delayFor(int consecutiveFailures) {
        if (consecutiveFailures <= 0) {
            throw new IllegalArgumentException(
                "consecutiveFailures must be positive (current: " + consecutiveFailures + ")"
            );
        }

        // shift 상한 30: overflow 방지
        int shift = Math.min(consecutiveFailures - 1, 30);
        long exponential = Math.min(baseDelayMs << shift, maxDelayMs);
        long jitter = (long) (exponential * jitterFactor * random.getAsDouble());
        return Duration.ofMillis(Math.min(exponential + jitter, maxDelayMs));
    }

    public long getBaseDelayMs() {
        return baseDelayMs;
    }

    public long getMaxDelayMs() {
        return maxDelayMs;
    }
}
