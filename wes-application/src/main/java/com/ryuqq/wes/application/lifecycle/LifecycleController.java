package com.ryuqq.wes.application.lifecycle;

import com.ryuqq.wes.application.provider.ProviderRegistry;
import com.ryuqq.wes.application.trigger.RunNotifier;
import com.ryuqq.wes.core.error.InvalidSubmissionException;
import com.ryuqq.wes.core.error.ProviderRunNotFoundException;
import com.ryuqq.wes.core.error.ProviderSubmissionException;
import com.ryuqq.wes.core.error.ProviderUnavailableException;
import com.ryuqq.wes.core.error.RunNotFoundException;
import com.ryuqq.wes.core.error.RunStoreException;
import com.ryuqq.wes.core.error.UnknownProviderException;
import com.ryuqq.wes.core.model.RunFilter;
import com.ryuqq.wes.core.model.RunId;
import com.ryuqq.wes.core.model.RunUpdate;
import com.ryuqq.wes.core.model.SubmissionSpec;
import com.ryuqq.wes.core.model.TaskLog;
import com.ryuqq.wes.core.model.WorkflowRun;
import com.ryuqq.wes.core.pagination.Page;
import com.ryuqq.wes.core.pagination.PageTokenCodec;
import com.ryuqq.wes.core.spi.ProviderAdapter;
import com.ryuqq.wes.core.spi.ProviderStatus;
import com.ryuqq.wes.core.spi.RunStore;
import com.ryuqq.wes.core.statemachine.RunState;
import com.ryuqq.wes.core.statemachine.StateTransition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Workflow Run 라이프사이클 컨트롤러.
 *
 * <p>요청 계층({@link RunLifecycle})과 리컨실 계층({@link Reconciler})을 모두 구현합니다.
 * 요청 계층은 저장소만 읽고 쓰며 Provider를 호출하지 않습니다.
 * 모든 Provider 호출은 {@link #reconcile(RunId)} 안에서 Run 단위 잠금을 보유한 채 일어납니다.</p>
 *
 * <p><strong>리컨실 패스:</strong></p>
 * <pre>
 * 1. tryLock(runId)                      → 실패 시 SKIPPED_LOCKED
 * 2. find(runId)                         → 없으면 NOT_FOUND, 종료 상태면 ALREADY_TERMINAL
 * 3. CANCELING + handle 없음              → CANCELED (Provider 호출 없음)
 * 4. nextAttemptAt 미도래                  → DEFERRED
 * 5. QUEUED                              → submit → INITIALIZING + handle
 *    그 외                                → getStatus → 전진하는 보고만 반영
 * 6. compareAndSet(runId, 관측 상태, 변경) → 실패 시 CONFLICT (아무것도 기록 안 됨)
 * 7. release(runId)
 * </pre>
 *
 * <p><strong>오류 분류:</strong></p>
 * <ul>
 *   <li>일시적 Provider 오류: providerFailures 증가 + 백오프, 한도 도달 시 SYSTEM_ERROR</li>
 *   <li>영구적 제출 거부: 즉시 SYSTEM_ERROR</li>
 *   <li>Provider가 handle을 모름: 즉시 SYSTEM_ERROR</li>
 *   <li>Run Store 오류: 패스 중단, 기록 없음 (ABORTED)</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class LifecycleController implements RunLifecycle, Reconciler {

    private static final Logger log = LoggerFactory.getLogger(LifecycleController.class);

    private final RunStore store;
    private final ProviderRegistry providers;
    private final RunNotifier notifier;
    private final LifecycleConfig config;
    private final BackoffCalculator backoff;
    private final Clock clock;
    private final PageTokenCodec tokenCodec = new PageTokenCodec();

    /**
     * 기본 백오프와 UTC 시스템 시계를 사용하는 생성자.
     *
     * @param store Run 저장소
     * @param providers Provider 레지스트리
     * @param notifier 제출/취소 알림 채널
     * @param config 설정
     */
    public LifecycleController(RunStore store, ProviderRegistry providers, RunNotifier notifier,
                               LifecycleConfig config) {
        this(store, providers, notifier, config, new BackoffCalculator(), Clock.systemUTC());
    }

    /**
     * 생성자.
     *
     * @param store Run 저장소
     * @param providers Provider 레지스트리
     * @param notifier 제출/취소 알림 채널
     * @param config 설정
     * @param backoff 일시적 실패 백오프 계산기
     * @param clock 시계
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public LifecycleController(RunStore store, ProviderRegistry providers, RunNotifier notifier,
                               LifecycleConfig config, BackoffCalculator backoff, Clock clock) {
        if (store == null) {
            throw new IllegalArgumentException("store cannot be null");
        }
        if (providers == null) {
            throw new IllegalArgumentException("providers cannot be null");
        }
        if (notifier == null) {
            throw new IllegalArgumentException("notifier cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (backoff == null) {
            throw new IllegalArgumentException("backoff cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.store = store;
        this.providers = providers;
        this.notifier = notifier;
        this.config = config;
        this.backoff = backoff;
        this.clock = clock;
    }

    // ============================================================
    // 요청 계층
    // ============================================================

    @Override
    public RunId submit(SubmissionSpec spec) {
        if (spec == null) {
            throw new InvalidSubmissionException("Submission cannot be null");
        }

        // 1. Provider 결정
        String providerType = spec.providerType() != null ? spec.providerType() : config.defaultProviderType();
        if (providerType == null) {
            throw new InvalidSubmissionException("No provider type specified and no default provider configured");
        }
        if (!providers.contains(providerType)) {
            throw new UnknownProviderException(providerType);
        }

        // 2. 워크플로우 언어 검증
        if (!config.supportsWorkflowType(spec.workflowType())) {
            throw new InvalidSubmissionException(String.format(
                "Unsupported workflow type: %s. Supported types: %s",
                spec.workflowType(), config.supportedWorkflowTypes()
            ));
        }

        // 3. 실행 이름 태그 보정
        SubmissionSpec normalized = spec.withProviderType(providerType);
        String name = spec.workflowEngineParameters().get("name");
        if (name != null && !name.isBlank() && !spec.tags().containsKey("Name")) {
            Map<String, String> tags = new LinkedHashMap<>(spec.tags());
            tags.put("Name", name);
            normalized = normalized.withTags(tags);
        }

        // 4. QUEUED로 저장 후 알림
        RunId runId = RunId.generate();
        store.create(WorkflowRun.queued(runId, normalized, providerType, clock.instant()));
        log.info("Run {} accepted for provider {} ({} {})",
            runId, providerType, normalized.workflowType(), normalized.workflowUrl());

        announce(runId);
        return runId;
    }

    @Override
    public RunState getStatus(RunId runId) {
        return getDetail(runId).state();
    }

    @Override
    public WorkflowRun getDetail(RunId runId) {
        if (runId == null) {
            throw new IllegalArgumentException("runId cannot be null");
        }
        return store.find(runId).orElseThrow(() -> new RunNotFoundException(runId));
    }

    @Override
    public RunState cancel(RunId runId) {
        if (runId == null) {
            throw new IllegalArgumentException("runId cannot be null");
        }

        // 1. CANCELING 전이 (경쟁 시 재조회 후 재시도)
        WorkflowRun canceling;
        while (true) {
            WorkflowRun current = getDetail(runId);
            if (!current.state().isCancelable()) {
                log.debug("Cancel of {} ignored in state {}", runId, current.state());
                return current.state();
            }
            RunUpdate update = RunUpdate.builder()
                .state(RunState.CANCELING)
                .appendLog(logLine(current.state(), RunState.CANCELING, "cancel requested"))
                .build();
            if (store.compareAndSet(runId, current.state(), update)) {
                canceling = current;
                break;
            }
        }
        log.info("Run {} cancel requested ({} → {})", runId, canceling.state(), RunState.CANCELING);

        // 2. 이미 제출된 Run은 즉시 Provider에 취소 전달 (확정은 리컨실이 담당)
        if (canceling.hasExternalHandle()) {
            dispatchCancelEagerly(canceling);
        }

        announce(runId);
        return RunState.CANCELING;
    }

    @Override
    public Page<WorkflowRun> list(RunFilter filter, String pageToken, Integer pageSize) {
        int size = config.resolvePageSize(pageSize);
        return store.list(filter == null ? RunFilter.all() : filter, pageToken, size);
    }

    @Override
    public Page<TaskLog> listTasks(RunId runId, String pageToken, Integer pageSize) {
        int size = config.resolvePageSize(pageSize);
        List<TaskLog> tasks = getDetail(runId).tasks();

        int offset = pageToken == null ? 0 : tokenCodec.decodeOffset(pageToken);
        if (offset >= tasks.size()) {
            return Page.empty();
        }
        int end = Math.min(offset + size, tasks.size());
        String next = end < tasks.size() ? tokenCodec.encodeOffset(end) : null;
        return new Page<>(tasks.subList(offset, end), next);
    }

    @Override
    public Map<String, String> availableProviders() {
        return providers.available();
    }

    // ============================================================
    // 리컨실 계층
    // ============================================================

    @Override
    public ReconcileOutcome reconcile(RunId runId) {
        if (runId == null) {
            throw new IllegalArgumentException("runId cannot be null");
        }

        boolean locked;
        try {
            locked = store.tryLock(runId);
        } catch (RunStoreException e) {
            log.error("Reconcile of {} aborted: lock acquisition failed", runId, e);
            return ReconcileOutcome.ABORTED;
        }
        if (!locked) {
            log.debug("Reconcile of {} skipped: another pass holds the lock", runId);
            return ReconcileOutcome.SKIPPED_LOCKED;
        }

        try {
            return reconcileLocked(runId);
        } catch (RunStoreException e) {
            log.error("Reconcile of {} aborted: run store failure", runId, e);
            return ReconcileOutcome.ABORTED;
        } finally {
            try {
                store.release(runId);
            } catch (RuntimeException e) {
                log.error("Failed to release lock for {}", runId, e);
            }
        }
    }

    private ReconcileOutcome reconcileLocked(RunId runId) {
        // 1. 스냅샷 조회
        Optional<WorkflowRun> found = store.find(runId);
        if (found.isEmpty()) {
            log.debug("Reconcile of {} skipped: run not found", runId);
            return ReconcileOutcome.NOT_FOUND;
        }
        WorkflowRun run = found.get();
        if (run.isTerminal()) {
            return ReconcileOutcome.ALREADY_TERMINAL;
        }

        Instant now = clock.instant();

        // 2. Provider에 제출된 적 없는 취소 요청은 Provider 호출 없이 확정
        if (run.state() == RunState.CANCELING && !run.hasExternalHandle()) {
            RunUpdate update = RunUpdate.builder()
                .state(RunState.CANCELED)
                .endTime(now)
                .lastReconciledAt(now)
                .clearNextAttemptAt()
                .appendLog(logLine(run.state(), RunState.CANCELED, "canceled before provider submission"))
                .build();
            return commit(run, update, ReconcileOutcome.CANCELED);
        }

        // 3. 백오프 대기 중이면 Provider 호출 생략
        if (run.nextAttemptAt() != null && run.nextAttemptAt().isAfter(now)) {
            RunUpdate update = RunUpdate.builder().lastReconciledAt(now).build();
            ReconcileOutcome outcome = commit(run, update, ReconcileOutcome.DEFERRED);
            log.debug("Reconcile of {} deferred until {}", runId, run.nextAttemptAt());
            return outcome;
        }

        // 4. QUEUED → 제출, 그 외 → 상태 갱신
        if (run.state() == RunState.QUEUED) {
            return submitToProvider(run, now);
        }
        if (!run.hasExternalHandle()) {
            return fail(run, now, "Run in " + run.state() + " has no external handle");
        }
        return refreshStatus(run, now);
    }

    private ReconcileOutcome submitToProvider(WorkflowRun run, Instant now) {
        ProviderAdapter adapter;
        try {
            adapter = providers.resolve(run.providerType());
        } catch (UnknownProviderException e) {
            return fail(run, now, "Provider no longer available: " + run.providerType());
        }

        String handle;
        try {
            handle = adapter.submit(run);
        } catch (ProviderUnavailableException e) {
            return transientFailure(run, now, e);
        } catch (ProviderSubmissionException e) {
            return fail(run, now, "Provider rejected submission: " + e.getMessage());
        }

        RunUpdate update = RunUpdate.builder()
            .state(RunState.INITIALIZING)
            .externalHandle(handle)
            .startTime(now)
            .lastReconciledAt(now)
            .providerFailures(0)
            .clearNextAttemptAt()
            .appendLog(logLine(RunState.QUEUED, RunState.INITIALIZING, "submitted to " + run.providerType()
                + " as " + handle))
            .build();
        if (store.compareAndSet(run.runId(), RunState.QUEUED, update)) {
            log.info("Run {} submitted to {} as {}", run.runId(), run.providerType(), handle);
            return ReconcileOutcome.SUBMITTED;
        }

        // 제출 중 취소 요청이 먼저 기록된 경우: handle을 보존하고 Provider 측 실행도 취소
        WorkflowRun latest = store.find(run.runId()).orElseThrow(() -> new RunNotFoundException(run.runId()));
        if (latest.state() == RunState.CANCELING && !latest.hasExternalHandle()) {
            boolean accepted = dispatchCancel(adapter, latest.runId(), handle);
            RunUpdate cancelUpdate = RunUpdate.builder()
                .externalHandle(handle)
                .startTime(now)
                .lastReconciledAt(now)
                .cancelDispatched(accepted)
                .appendLog(now + " submitted to " + run.providerType() + " as " + handle
                    + " while cancel was pending; cancel dispatched")
                .build();
            if (store.compareAndSet(latest.runId(), RunState.CANCELING, cancelUpdate)) {
                log.info("Run {} submitted as {} during cancel; provider cancel dispatched", run.runId(), handle);
                return ReconcileOutcome.SUBMITTED;
            }
        }

        log.error("Run {} moved to {} while submitting; orphan handle {} canceled",
            run.runId(), latest.state(), handle);
        dispatchCancel(adapter, run.runId(), handle);
        return ReconcileOutcome.CONFLICT;
    }

    private ReconcileOutcome refreshStatus(WorkflowRun run, Instant now) {
        ProviderAdapter adapter;
        try {
            adapter = providers.resolve(run.providerType());
        } catch (UnknownProviderException e) {
            return fail(run, now, "Provider no longer available: " + run.providerType());
        }

        ProviderStatus status;
        try {
            status = adapter.getStatus(run.externalHandle());
        } catch (ProviderUnavailableException e) {
            return transientFailure(run, now, e);
        } catch (ProviderRunNotFoundException e) {
            return fail(run, now, "Provider has no record of handle " + e.getExternalHandle());
        }

        RunState reported = status.state();
        RunUpdate.Builder update = RunUpdate.builder()
            .tasks(status.tasks())
            .lastReconciledAt(now)
            .providerFailures(0)
            .clearNextAttemptAt();

        boolean advanced = StateTransition.isForward(run.state(), reported);
        if (advanced) {
            update.state(reported)
                .appendLog(logLine(run.state(), reported, "provider reported " + status.nativeStatus()));
            if (reported.isTerminal()) {
                update.endTime(now);
            }
            if (reported == RunState.COMPLETE) {
                update.outputs(status.outputs());
            }
            if (reported == RunState.EXECUTOR_ERROR || reported == RunState.SYSTEM_ERROR) {
                update.errorMessage(status.message() != null
                    ? status.message()
                    : "Provider reported " + status.nativeStatus());
            }
        } else if (reported == RunState.UNKNOWN) {
            log.warn("Run {} ignored unmapped {} status '{}'", run.runId(), run.providerType(), status.nativeStatus());
        } else if (reported != run.state()) {
            log.debug("Run {} ignored non-forward report {} → {}", run.runId(), run.state(), reported);
        }

        // Provider가 아직 취소를 수락하지 않았다면 재전달
        if (run.state() == RunState.CANCELING && !reported.isTerminal() && !run.cancelDispatched()) {
            if (dispatchCancel(adapter, run.runId(), run.externalHandle())) {
                update.cancelDispatched(true);
            }
        }

        if (!store.compareAndSet(run.runId(), run.state(), update.build())) {
            log.info("Run {} changed during reconcile; report discarded", run.runId());
            return ReconcileOutcome.CONFLICT;
        }
        if (!advanced) {
            return ReconcileOutcome.REFRESHED;
        }
        log.info("Run {} {} → {} ({})", run.runId(), run.state(), reported, status.nativeStatus());
        return reported == RunState.CANCELED ? ReconcileOutcome.CANCELED : ReconcileOutcome.STATE_CHANGED;
    }

    private ReconcileOutcome transientFailure(WorkflowRun run, Instant now, ProviderUnavailableException e) {
        int failures = run.providerFailures() + 1;
        if (failures >= config.maxProviderFailures()) {
            return fail(run, now, String.format("Provider %s unavailable after %d consecutive attempts: %s",
                run.providerType(), failures, e.getMessage()));
        }

        Instant nextAttemptAt = now.plus(backoff.delayFor(failures));
        RunUpdate update = RunUpdate.builder()
            .lastReconciledAt(now)
            .providerFailures(failures)
            .nextAttemptAt(nextAttemptAt)
            .appendLog(now + " provider " + run.providerType() + " unavailable (attempt " + failures + "): "
                + e.getMessage())
            .build();
        ReconcileOutcome outcome = commit(run, update, ReconcileOutcome.TRANSIENT_FAILURE);
        if (outcome == ReconcileOutcome.TRANSIENT_FAILURE) {
            log.warn("Run {} provider {} unavailable (attempt {}/{}), next attempt at {}: {}",
                run.runId(), run.providerType(), failures, config.maxProviderFailures(), nextAttemptAt,
                e.getMessage());
        }
        return outcome;
    }

    private ReconcileOutcome fail(WorkflowRun run, Instant now, String message) {
        RunUpdate update = RunUpdate.builder()
            .state(RunState.SYSTEM_ERROR)
            .errorMessage(message)
            .endTime(now)
            .lastReconciledAt(now)
            .clearNextAttemptAt()
            .appendLog(logLine(run.state(), RunState.SYSTEM_ERROR, message))
            .build();
        ReconcileOutcome outcome = commit(run, update, ReconcileOutcome.SYSTEM_ERROR);
        if (outcome == ReconcileOutcome.SYSTEM_ERROR) {
            log.error("Run {} {} → {}: {}", run.runId(), run.state(), RunState.SYSTEM_ERROR, message);
        }
        return outcome;
    }

    private ReconcileOutcome commit(WorkflowRun run, RunUpdate update, ReconcileOutcome onSuccess) {
        if (store.compareAndSet(run.runId(), run.state(), update)) {
            return onSuccess;
        }
        log.info("Run {} changed during reconcile; pass discarded", run.runId());
        return ReconcileOutcome.CONFLICT;
    }

    // ============================================================
    // 취소 전달
    // ============================================================

    private void dispatchCancelEagerly(WorkflowRun run) {
        ProviderAdapter adapter;
        try {
            adapter = providers.resolve(run.providerType());
        } catch (UnknownProviderException e) {
            log.warn("Run {} cancel not dispatched: provider {} no longer registered", run.runId(), run.providerType());
            return;
        }
        if (!dispatchCancel(adapter, run.runId(), run.externalHandle())) {
            return;
        }
        RunUpdate update = RunUpdate.builder()
            .cancelDispatched(true)
            .appendLog(clock.instant() + " cancel dispatched to " + run.providerType())
            .build();
        if (!store.compareAndSet(run.runId(), RunState.CANCELING, update)) {
            log.debug("Run {} left CANCELING before cancel dispatch was recorded", run.runId());
        }
    }

    private boolean dispatchCancel(ProviderAdapter adapter, RunId runId, String handle) {
        try {
            boolean accepted = adapter.cancel(handle);
            if (!accepted) {
                log.warn("Provider {} did not accept cancel of {} ({})", adapter.providerType(), runId, handle);
            }
            return accepted;
        } catch (ProviderUnavailableException e) {
            log.warn("Cancel of {} ({}) not delivered to {}: {}", runId, handle, adapter.providerType(),
                e.getMessage());
            return false;
        }
    }

    private void announce(RunId runId) {
        try {
            notifier.announce(runId);
        } catch (RuntimeException e) {
            log.warn("Failed to announce {}; poll loop will pick it up", runId, e);
        }
    }

    private String logLine(RunState from, RunState to, String reason) {
        return clock.instant() + " " + from + " → " + to + ": " + reason;
    }
}
