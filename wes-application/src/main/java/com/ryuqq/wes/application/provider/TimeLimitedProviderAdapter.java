package com.ryuqq.wes.application.provider;

import com.ryuqq.wes.core.error.ProviderException;
import com.ryuqq.wes.core.error.ProviderRunNotFoundException;
import com.ryuqq.wes.core.error.ProviderSubmissionException;
import com.ryuqq.wes.core.error.ProviderUnavailableException;
import com.ryuqq.wes.core.model.WorkflowRun;
import com.ryuqq.wes.core.spi.ProviderAdapter;
import com.ryuqq.wes.core.spi.ProviderStatus;
import com.ryuqq.wes.core.spi.StatusMapping;

import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * 모든 Provider 호출에 명시적 타임아웃을 적용하는 데코레이터.
 *
 * <p>호출은 전용 executor에서 실행되고, 호출 스레드는 timeout까지만 기다립니다.
 * 이 타임아웃은 리컨실 워커 자체의 타임아웃과 별개입니다.</p>
 *
 * <p><strong>분류 규칙:</strong></p>
 * <ul>
 *   <li>타임아웃 → {@link ProviderUnavailableException} (같은 호출 안에서 재시도하지 않음)</li>
 *   <li>대기 중 인터럽트 → {@link ProviderUnavailableException}, 인터럽트 플래그 복원</li>
 *   <li>Adapter의 예상치 못한 RuntimeException → {@link ProviderUnavailableException}</li>
 *   <li>선언된 Provider 예외 → 그대로 전달</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class TimeLimitedProviderAdapter implements ProviderAdapter {

    private final ProviderAdapter delegate;
    private final ExecutorService callExecutor;
    private final Duration timeout;

    /**
     * 생성자.
     *
     * @param delegate 실제 Adapter
     * @param callExecutor Provider 호출 전용 executor
     * @param timeout 호출당 타임아웃 (양수)
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public TimeLimitedProviderAdapter(ProviderAdapter delegate, ExecutorService callExecutor, Duration timeout) {
        if (delegate == null) {
            throw new IllegalArgumentException("delegate cannot be null");
        }
        if (callExecutor == null) {
            throw new IllegalArgumentException("callExecutor cannot be null");
        }
        if (timeout == null || timeout.isZero() || timeout.isNegative()) {
            throw new IllegalArgumentException("timeout must be positive (current: " + timeout + ")");
        }
        this.delegate = delegate;
        this.callExecutor = callExecutor;
        this.timeout = timeout;
    }

    @Override
    public String providerType() {
        return delegate.providerType();
    }

    @Override
    public String submit(WorkflowRun run) throws ProviderSubmissionException, ProviderUnavailableException {
        try {
            return call("submit", () -> delegate.submit(run));
        } catch (ProviderSubmissionException | ProviderUnavailableException e) {
            throw e;
        } catch (ProviderException e) {
            throw new ProviderSubmissionException(e.getMessage(), e);
        }
    }

    @Override
    public ProviderStatus getStatus(String externalHandle)
        throws ProviderUnavailableException, ProviderRunNotFoundException {
        try {
            return call("getStatus", () -> delegate.getStatus(externalHandle));
        } catch (ProviderUnavailableException | ProviderRunNotFoundException e) {
            throw e;
        } catch (ProviderException e) {
            throw new ProviderUnavailableException(e.getMessage(), e);
        }
    }

    @Override
    public boolean cancel(String externalHandle) throws ProviderUnavailableException {
        try {
            return call("cancel", () -> delegate.cancel(externalHandle));
        } catch (ProviderUnavailableException e) {
            throw e;
        } catch (ProviderException e) {
            throw new ProviderUnavailableException(e.getMessage(), e);
        }
    }

    @Override
    public StatusMapping statusMapping() {
        return delegate.statusMapping();
    }

    /**
     * 데코레이트된 원본 Adapter.
     *
     * @return delegate
     */
    public ProviderAdapter getDelegate() {
        return delegate;
    }

    private <T> T call(String operation, ProviderCall<T> providerCall) throws ProviderException {
        Future<T> future;
        try {
            future = callExecutor.submit(providerCall::call);
        } catch (RejectedExecutionException e) {
            throw new ProviderUnavailableException(
                String.format("%s %s rejected: provider call executor is shut down", providerType(), operation), e
            );
        }

        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new ProviderUnavailableException(
                String.format("%s %s timed out after %dms", providerType(), operation, timeout.toMillis()), e
            );
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new ProviderUnavailableException(
                String.format("%s %s interrupted", providerType(), operation), e
            );
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof ProviderException) {
                throw (ProviderException) cause;
            }
            throw new ProviderUnavailableException(
                String.format("%s %s failed unexpectedly: %s", providerType(), operation, cause), cause
            );
        }
    }

    @FunctionalInterface
    private interface ProviderCall<T> {
        T call() throws ProviderException;
    }
}
