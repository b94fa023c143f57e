package com.ryuqq.wes.testkit.fixture;

import com.ryuqq.wes.core.model.RunId;
import com.ryuqq.wes.core.model.SubmissionSpec;
import com.ryuqq.wes.core.model.TaskLog;
import com.ryuqq.wes.core.model.WorkflowRun;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Test data builders for runs, specs and tasks.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class RunFixtures {

    public static final String WORKFLOW_URL = "https://example.org/workflows/hello.cwl";
    public static final Instant EPOCH = Instant.parse("2026-01-01T00:00:00Z");

    private RunFixtures() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * CWL submission spec bound to the given provider.
     *
     * @param providerType provider type (nullable)
     * @return submission spec
     */
    public static SubmissionSpec spec(String providerType) {
        return new SubmissionSpec(
            WORKFLOW_URL,
            "CWL",
            "v1.2",
            Map.of("message", "hello"),
            null,
            null,
            Map.of(),
            Map.of("project", "test"),
            providerType,
            "tester"
        );
    }

    /**
     * QUEUED run that has not been stored yet.
     *
     * @param providerType provider type
     * @return QUEUED run with a fresh id
     */
    public static WorkflowRun queuedRun(String providerType) {
        return queuedRun(RunId.generate(), providerType, EPOCH);
    }

    /**
     * QUEUED run that has not been stored yet.
     *
     * @param runId run ID
     * @param providerType provider type
     * @param createdAt creation time
     * @return QUEUED run
     */
    public static WorkflowRun queuedRun(RunId runId, String providerType, Instant createdAt) {
        return WorkflowRun.queued(runId, spec(providerType), providerType, createdAt);
    }

    /**
     * Task reported by a backend.
     *
     * @param id task ID
     * @param nativeStatus backend task status
     * @return task log
     */
    public static TaskLog task(String id, String nativeStatus) {
        return new TaskLog(id, "step-" + id, List.of("run", id), EPOCH, null, null,
            "logs/" + id + ".out", "logs/" + id + ".err", nativeStatus);
    }
}
