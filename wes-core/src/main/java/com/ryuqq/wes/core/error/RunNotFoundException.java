package com.ryuqq.wes.core.error;

import com.ryuqq.wes.core.model.RunId;

/**
 * 존재하지 않는 Run에 대한 조회 또는 취소 요청.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class RunNotFoundException extends RuntimeException {

    private final RunId runId;

    public RunNotFoundException(RunId runId) {
        super("Run not found: " + runId.getValue());
        this.runId = runId;
    }

    public RunId getRunId() {
        return runId;
    }
}
