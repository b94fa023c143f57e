package com.ryuqq.wes.core.model;

import com.ryuqq.wes.core.statemachine.RunState;
import com.ryuqq.wes.core.statemachine.StateTransition;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * 한 번의 리컨실 패스가 Run에 기록할 변경 집합.
 *
 * <p>변경은 {@link #applyTo(WorkflowRun)}로 한꺼번에 적용됩니다. Run Store는 이 결과를
 * compare-and-set으로 교체하므로 하나의 패스는 전부 기록되거나 전혀 기록되지 않습니다.</p>
 *
 * <p><strong>applyTo 시 검증되는 불변식:</strong></p>
 * <ul>
 *   <li>상태 변경은 {@link StateTransition#validate}를 통과해야 함</li>
 *   <li>externalHandle은 기존 값이 없을 때만 설정 가능</li>
 *   <li>errorMessage는 SYSTEM_ERROR/EXECUTOR_ERROR 진입 시에만 설정 가능</li>
 *   <li>outputs는 COMPLETE 진입 시에만 설정 가능</li>
 * </ul>
 *
 * <p>설정되지 않은 필드는 기존 값을 유지합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class RunUpdate {

    private final RunState state;
    private final String externalHandle;
    private final Instant lastReconciledAt;
    private final Instant startTime;
    private final Instant endTime;
    private final String errorMessage;
    private final Map<String, Object> outputs;
    private final List<TaskLog> tasks;
    private final List<String> logLines;
    private final Integer providerFailures;
    private final Instant nextAttemptAt;
    private final boolean clearNextAttemptAt;
    private final Boolean cancelDispatched;

    private RunUpdate(Builder builder) {
        this.state = builder.state;
        this.externalHandle = builder.externalHandle;
        this.lastReconciledAt = builder.lastReconciledAt;
        this.startTime = builder.startTime;
        this.endTime = builder.endTime;
        this.errorMessage = builder.errorMessage;
        this.outputs = builder.outputs;
        this.tasks = builder.tasks;
        this.logLines = List.copyOf(builder.logLines);
        this.providerFailures = builder.providerFailures;
        this.nextAttemptAt = builder.nextAttemptAt;
        this.clearNextAttemptAt = builder.clearNextAttemptAt;
        this.cancelDispatched = builder.cancelDispatched;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * 변경 집합을 현재 Run에 적용한 새 인스턴스 생성.
     *
     * @param current 현재 저장된 Run
     * @return 변경이 적용된 Run
     * @throws IllegalStateException 불변식을 위반하는 변경인 경우
     */
    public WorkflowRun applyTo(WorkflowRun current) {
        if (current == null) {
            throw new IllegalArgumentException("current cannot be null");
        }

        RunState nextState = current.state();
        boolean stateChanged = state != null && state != current.state();
        if (stateChanged) {
            StateTransition.validate(current.state(), state);
            nextState = state;
        }

        if (externalHandle != null && current.externalHandle() != null
            && !externalHandle.equals(current.externalHandle())) {
            throw new IllegalStateException(String.format(
                "External handle already assigned for %s: %s", current.runId(), current.externalHandle()
            ));
        }
        if (errorMessage != null
            && !(stateChanged && (nextState == RunState.SYSTEM_ERROR || nextState == RunState.EXECUTOR_ERROR))) {
            throw new IllegalStateException("errorMessage can only be set on entry into an error state");
        }
        if (outputs != null && !(stateChanged && nextState == RunState.COMPLETE)) {
            throw new IllegalStateException("outputs can only be set on entry into COMPLETE");
        }

        return new WorkflowRun(
            current.runId(),
            current.sequence(),
            nextState,
            current.providerType(),
            externalHandle != null ? externalHandle : current.externalHandle(),
            current.spec(),
            current.createdAt(),
            lastReconciledAt != null ? lastReconciledAt : current.lastReconciledAt(),
            startTime != null ? startTime : current.startTime(),
            endTime != null ? endTime : current.endTime(),
            errorMessage != null ? errorMessage : current.errorMessage(),
            outputs != null ? outputs : current.outputs(),
            tasks != null ? tasks : current.tasks(),
            current.appendLogs(logLines),
            providerFailures != null ? providerFailures : current.providerFailures(),
            clearNextAttemptAt ? null : (nextAttemptAt != null ? nextAttemptAt : current.nextAttemptAt()),
            cancelDispatched != null ? cancelDispatched : current.cancelDispatched()
        );
    }

    public RunState getState() {
        return state;
    }

    public String getExternalHandle() {
        return externalHandle;
    }

    public Instant getLastReconciledAt() {
        return lastReconciledAt;
    }

    public List<TaskLog> getTasks() {
        return tasks;
    }

    public List<String> getLogLines() {
        return logLines;
    }

    /**
     * RunUpdate 빌더.
     */
    public static final class Builder {

        private RunState state;
        private String externalHandle;
        private Instant lastReconciledAt;
        private Instant startTime;
        private Instant endTime;
        private String errorMessage;
        private Map<String, Object> outputs;
        private List<TaskLog> tasks;
        private final List<String> logLines = new ArrayList<>();
        private Integer providerFailures;
        private Instant nextAttemptAt;
        private boolean clearNextAttemptAt;
        private Boolean cancelDispatched;

        private Builder() {
        }

        public Builder state(RunState state) {
            this.state = state;
            return this;
        }

        public Builder externalHandle(String externalHandle) {
            this.externalHandle = externalHandle;
            return this;
        }

        public Builder lastReconciledAt(Instant lastReconciledAt) {
            this.lastReconciledAt = lastReconciledAt;
            return this;
        }

        public Builder startTime(Instant startTime) {
            this.startTime = startTime;
            return this;
        }

        public Builder endTime(Instant endTime) {
            this.endTime = endTime;
            return this;
        }

        public Builder errorMessage(String errorMessage) {
            this.errorMessage = errorMessage;
            return this;
        }

        public Builder outputs(Map<String, Object> outputs) {
            this.outputs = outputs == null ? Map.of() : outputs;
            return this;
        }

        public Builder tasks(List<TaskLog> tasks) {
            this.tasks = tasks == null ? List.of() : List.copyOf(tasks);
            return this;
        }

        public Builder appendLog(String line) {
            if (line != null && !line.isBlank()) {
                this.logLines.add(line);
            }
            return this;
        }

        public Builder providerFailures(int providerFailures) {
            this.providerFailures = providerFailures;
            return this;
        }

        public Builder nextAttemptAt(Instant nextAttemptAt) {
            this.nextAttemptAt = nextAttemptAt;
            this.clearNextAttemptAt = nextAttemptAt == null;
            return this;
        }

        public Builder clearNextAttemptAt() {
            this.nextAttemptAt = null;
            this.clearNextAttemptAt = true;
            return this;
        }

        public Builder cancelDispatched(boolean cancelDispatched) {
            this.cancelDispatched = cancelDispatched;
            return this;
        }

        public RunUpdate build() {
            return new RunUpdate(this);
        }
    }
}
