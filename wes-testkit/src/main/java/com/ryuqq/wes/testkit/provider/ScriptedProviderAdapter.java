package com.ryuqq.wes.testkit.provider;

import com.ryuqq.wes.core.error.ProviderException;
import com.ryuqq.wes.core.error.ProviderRunNotFoundException;
import com.ryuqq.wes.core.error.ProviderSubmissionException;
import com.ryuqq.wes.core.error.ProviderUnavailableException;
import com.ryuqq.wes.core.model.TaskLog;
import com.ryuqq.wes.core.model.WorkflowRun;
import com.ryuqq.wes.core.spi.ProviderAdapter;
import com.ryuqq.wes.core.spi.ProviderStatus;
import com.ryuqq.wes.core.spi.StatusMapping;
import com.ryuqq.wes.core.statemachine.RunState;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Scripted in-process backend for engine tests.
 *
 * <p>Each call consumes the next scripted reply. When the submit script is empty,
 * a handle {@code "<providerType>-<n>"} is generated. When the status script is empty,
 * the last reported status is repeated.</p>
 *
 * <p><strong>Native vocabulary:</strong></p>
 * <pre>
 * QUEUED, PENDING → QUEUED      STARTING → INITIALIZING
 * RUNNING → RUNNING             PAUSED → PAUSED
 * SUCCEEDED → COMPLETE          FAILED → EXECUTOR_ERROR
 * ERROR → SYSTEM_ERROR          CANCELLED, CANCELED → CANCELED
 * </pre>
 *
 * <p><strong>Usage:</strong></p>
 * <pre>
 * ScriptedProviderAdapter mockA = new ScriptedProviderAdapter("mockA")
 *     .willSubmit("h1")
 *     .willReport("RUNNING")
 *     .willReport("SUCCEEDED", Map.of("result", "s3://out"), List.of());
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class ScriptedProviderAdapter implements ProviderAdapter {

    private static final StatusMapping MAPPING = StatusMapping.builder()
        .map(RunState.QUEUED, "QUEUED", "PENDING")
        .map(RunState.INITIALIZING, "STARTING")
        .map(RunState.RUNNING, "RUNNING")
        .map(RunState.PAUSED, "PAUSED")
        .map(RunState.COMPLETE, "SUCCEEDED")
        .map(RunState.EXECUTOR_ERROR, "FAILED")
        .map(RunState.SYSTEM_ERROR, "ERROR")
        .map(RunState.CANCELED, "CANCELLED", "CANCELED")
        .build();

    private final String providerType;
    private final Deque<Object> submitReplies = new ArrayDeque<>();
    private final Deque<Object> statusReplies = new ArrayDeque<>();
    private final Deque<Object> cancelReplies = new ArrayDeque<>();
    private final List<WorkflowRun> submittedRuns = new ArrayList<>();
    private final List<String> statusHandles = new ArrayList<>();
    private final List<String> canceledHandles = new ArrayList<>();
    private final AtomicInteger handleCounter = new AtomicInteger();
    private ProviderStatus lastStatus;
    private volatile Duration callDelay = Duration.ZERO;

    public ScriptedProviderAdapter(String providerType) {
        if (providerType == null || providerType.isBlank()) {
            throw new IllegalArgumentException("providerType cannot be null or blank");
        }
        this.providerType = providerType;
    }

    // ============================================================
    // Script
    // ============================================================

    public synchronized ScriptedProviderAdapter willSubmit(String handle) {
        submitReplies.add(handle);
        return this;
    }

    public synchronized ScriptedProviderAdapter willFailSubmit(ProviderException failure) {
        submitReplies.add(failure);
        return this;
    }

    public ScriptedProviderAdapter willReport(String nativeStatus) {
        return willReport(nativeStatus, Map.of(), List.of());
    }

    public synchronized ScriptedProviderAdapter willReport(
        String nativeStatus, Map<String, Object> outputs, List<TaskLog> tasks
    ) {
        String message = MAPPING.map(nativeStatus) == RunState.EXECUTOR_ERROR
            || MAPPING.map(nativeStatus) == RunState.SYSTEM_ERROR
            ? "backend reported " + nativeStatus
            : null;
        statusReplies.add(new ProviderStatus(MAPPING.map(nativeStatus), nativeStatus, outputs, tasks, message));
        return this;
    }

    public synchronized ScriptedProviderAdapter willFailStatus(ProviderException failure) {
        statusReplies.add(failure);
        return this;
    }

    public synchronized ScriptedProviderAdapter willCancel(boolean accepted) {
        cancelReplies.add(accepted);
        return this;
    }

    public synchronized ScriptedProviderAdapter willFailCancel(ProviderUnavailableException failure) {
        cancelReplies.add(failure);
        return this;
    }

    /**
     * Delays every backend call, e.g. to widen race windows or trigger timeouts.
     *
     * @param delay delay per call
     * @return this
     */
    public ScriptedProviderAdapter withCallDelay(Duration delay) {
        this.callDelay = delay;
        return this;
    }

    // ============================================================
    // ProviderAdapter
    // ============================================================

    @Override
    public String providerType() {
        return providerType;
    }

    @Override
    public String submit(WorkflowRun run) throws ProviderSubmissionException, ProviderUnavailableException {
        pause();
        Object reply;
        synchronized (this) {
            submittedRuns.add(run);
            reply = submitReplies.poll();
        }
        if (reply instanceof ProviderSubmissionException) {
            throw (ProviderSubmissionException) reply;
        }
        if (reply instanceof ProviderUnavailableException) {
            throw (ProviderUnavailableException) reply;
        }
        if (reply instanceof ProviderException) {
            throw new ProviderSubmissionException(((ProviderException) reply).getMessage(), (Throwable) reply);
        }
        return reply != null ? (String) reply : providerType + "-" + handleCounter.incrementAndGet();
    }

    @Override
    public ProviderStatus getStatus(String externalHandle)
        throws ProviderUnavailableException, ProviderRunNotFoundException {
        pause();
        Object reply;
        synchronized (this) {
            statusHandles.add(externalHandle);
            reply = statusReplies.poll();
            if (reply instanceof ProviderStatus) {
                lastStatus = (ProviderStatus) reply;
            } else if (reply == null) {
                reply = lastStatus != null ? lastStatus : ProviderStatus.of(RunState.QUEUED, "QUEUED");
            }
        }
        if (reply instanceof ProviderUnavailableException) {
            throw (ProviderUnavailableException) reply;
        }
        if (reply instanceof ProviderRunNotFoundException) {
            throw (ProviderRunNotFoundException) reply;
        }
        if (reply instanceof ProviderException) {
            throw new ProviderUnavailableException(((ProviderException) reply).getMessage(), (Throwable) reply);
        }
        return (ProviderStatus) reply;
    }

    @Override
    public boolean cancel(String externalHandle) throws ProviderUnavailableException {
        pause();
        Object reply;
        synchronized (this) {
            canceledHandles.add(externalHandle);
            reply = cancelReplies.poll();
        }
        if (reply instanceof ProviderUnavailableException) {
            throw (ProviderUnavailableException) reply;
        }
        return reply == null || (Boolean) reply;
    }

    @Override
    public StatusMapping statusMapping() {
        return MAPPING;
    }

    // ============================================================
    // Recorded calls
    // ============================================================

    public synchronized int submitCount() {
        return submittedRuns.size();
    }

    public synchronized List<WorkflowRun> submittedRuns() {
        return List.copyOf(submittedRuns);
    }

    public synchronized int statusCount() {
        return statusHandles.size();
    }

    public synchronized List<String> canceledHandles() {
        return List.copyOf(canceledHandles);
    }

    private void pause() throws ProviderUnavailableException {
        Duration delay = callDelay;
        if (delay.isZero()) {
            return;
        }
        try {
            Thread.sleep(delay.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ProviderUnavailableException("Interrupted while calling " + providerType, e);
        }
    }
}
