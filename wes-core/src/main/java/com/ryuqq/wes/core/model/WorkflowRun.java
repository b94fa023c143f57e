package com.ryuqq.wes.core.model;

import com.ryuqq.wes.core.statemachine.RunState;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Workflow Run 레코드 (불변).
 *
 * <p>제출부터 종료 상태까지 추적되는 작업 단위입니다. 모든 변경은
 * {@link RunUpdate#applyTo(WorkflowRun)}를 통해 새 인스턴스로 만들어지며,
 * Run Store가 compare-and-set으로 원자적으로 교체합니다.</p>
 *
 * <p><strong>불변식:</strong></p>
 * <ul>
 *   <li>runId, providerType, spec, createdAt은 생성 후 변경 불가</li>
 *   <li>externalHandle은 제출 전이에서 한 번만 설정</li>
 *   <li>errorMessage는 SYSTEM_ERROR/EXECUTOR_ERROR 진입 시에만 설정</li>
 *   <li>outputs는 COMPLETE 진입 시에만 설정</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param runId Run 식별자
 * @param sequence 저장소가 부여한 생성 순번 (저장 전 0)
 * @param state 현재 상태
 * @param providerType 실행 Provider
 * @param externalHandle Provider가 부여한 식별자 (nullable)
 * @param spec 제출 파라미터
 * @param createdAt 생성 시각
 * @param lastReconciledAt 마지막 리컨실 시각 (nullable)
 * @param startTime Provider 제출 성공 시각 (nullable)
 * @param endTime 종료 상태 진입 시각 (nullable)
 * @param errorMessage 오류 메시지 (nullable)
 * @param outputs 실행 결과
 * @param tasks 최근 상태 갱신 시점의 task 목록
 * @param systemLogs 상태 전이 및 Provider 오류 기록 (추가만 가능)
 * @param providerFailures 연속된 일시적 Provider 실패 횟수
 * @param nextAttemptAt 백오프 중인 경우 다음 Provider 호출 가능 시각 (nullable)
 * @param cancelDispatched Provider가 cancel 요청을 수락했는지 여부
 */
public record WorkflowRun(
    RunId runId,
    long sequence,
    RunState state,
    String providerType,
    String externalHandle,
    SubmissionSpec spec,
    Instant createdAt,
    Instant lastReconciledAt,
    Instant startTime,
    Instant endTime,
    String errorMessage,
    Map<String, Object> outputs,
    List<TaskLog> tasks,
    List<String> systemLogs,
    int providerFailures,
    Instant nextAttemptAt,
    boolean cancelDispatched
) {

    public WorkflowRun {
        if (runId == null) {
            throw new IllegalArgumentException("runId cannot be null");
        }
        if (state == null) {
            throw new IllegalArgumentException("state cannot be null");
        }
        if (state == RunState.UNKNOWN) {
            throw new IllegalArgumentException("UNKNOWN cannot be stored as a run state");
        }
        if (providerType == null || providerType.isBlank()) {
            throw new IllegalArgumentException("providerType cannot be null or blank");
        }
        if (spec == null) {
            throw new IllegalArgumentException("spec cannot be null");
        }
        if (createdAt == null) {
            throw new IllegalArgumentException("createdAt cannot be null");
        }
        if (providerFailures < 0) {
            throw new IllegalArgumentException(
                "providerFailures must not be negative (current: " + providerFailures + ")"
            );
        }
        outputs = outputs == null || outputs.isEmpty()
            ? Collections.emptyMap()
            : Collections.unmodifiableMap(new LinkedHashMap<>(outputs));
        tasks = tasks == null ? List.of() : List.copyOf(tasks);
        systemLogs = systemLogs == null ? List.of() : List.copyOf(systemLogs);
    }

    /**
     * 새 QUEUED Run 생성.
     *
     * @param runId Run 식별자
     * @param spec 제출 파라미터
     * @param providerType 확정된 Provider
     * @param createdAt 생성 시각
     * @return QUEUED 상태의 Run (sequence는 저장 시 부여)
     */
    public static WorkflowRun queued(RunId runId, SubmissionSpec spec, String providerType, Instant createdAt) {
        return new WorkflowRun(
            runId, 0L, RunState.QUEUED, providerType, null, spec, createdAt,
            null, null, null, null, null, null,
            List.of(createdAt + " run created in QUEUED for provider " + providerType),
            0, null, false
        );
    }

    /**
     * 저장소가 순번을 부여한 새 인스턴스 생성.
     *
     * @param sequence 생성 순번 (양수)
     * @return sequence가 설정된 Run
     */
    public WorkflowRun withSequence(long sequence) {
        if (sequence <= 0) {
            throw new IllegalArgumentException("sequence must be positive (current: " + sequence + ")");
        }
        return new WorkflowRun(runId, sequence, state, providerType, externalHandle, spec, createdAt,
            lastReconciledAt, startTime, endTime, errorMessage, outputs, tasks, systemLogs,
            providerFailures, nextAttemptAt, cancelDispatched);
    }

    /**
     * external handle 보유 여부.
     *
     * @return Provider에 제출된 경우 true
     */
    public boolean hasExternalHandle() {
        return externalHandle != null;
    }

    /**
     * 종료 상태 여부.
     *
     * @return 종료 상태인 경우 true
     */
    public boolean isTerminal() {
        return state.isTerminal();
    }

    /**
     * 마지막 리컨실 시각 (한 번도 없으면 생성 시각).
     *
     * @return staleness 판단 기준 시각
     */
    public Instant lastTouchedAt() {
        return lastReconciledAt != null ? lastReconciledAt : createdAt;
    }

    List<String> appendLogs(List<String> lines) {
        if (lines.isEmpty()) {
            return systemLogs;
        }
        List<String> merged = new ArrayList<>(systemLogs.size() + lines.size());
        merged.addAll(systemLogs);
        merged.addAll(lines);
        return merged;
    }
}
