package com.ryuqq.wes.core.model;

import com.ryuqq.wes.core.statemachine.RunState;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * RunUpdate 테스트.
 *
 * <p>변경 집합 적용과 Run 불변식 검증을 확인합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class RunUpdateTest {

    private static final Instant NOW = Instant.parse("2026-01-01T00:00:00Z");

    private WorkflowRun queued;

    @BeforeEach
    void setUp() {
        SubmissionSpec spec = SubmissionSpec.of("https://example.org/wf.cwl", "CWL", "v1.2");
        queued = WorkflowRun.queued(RunId.of("run-1"), spec, "mockA", NOW).withSequence(1);
    }

    @Test
    void applyTo_Submission_SetsHandleStateAndStartTime() {
        // Given
        RunUpdate update = RunUpdate.builder()
            .state(RunState.INITIALIZING)
            .externalHandle("h1")
            .startTime(NOW)
            .lastReconciledAt(NOW)
            .appendLog("submitted")
            .build();

        // When
        WorkflowRun updated = update.applyTo(queued);

        // Then
        assertEquals(RunState.INITIALIZING, updated.state());
        assertEquals("h1", updated.externalHandle());
        assertEquals(NOW, updated.startTime());
        assertEquals(NOW, updated.lastReconciledAt());
        assertEquals(1L, updated.sequence());
        assertEquals(2, updated.systemLogs().size());
    }

    @Test
    void applyTo_EmptyUpdate_KeepsEverything() {
        // When
        WorkflowRun updated = RunUpdate.builder().build().applyTo(queued);

        // Then
        assertEquals(queued, updated);
    }

    @Test
    void applyTo_SecondHandle_ThrowsException() {
        // Given
        WorkflowRun submitted = RunUpdate.builder()
            .state(RunState.INITIALIZING).externalHandle("h1").build().applyTo(queued);

        // When & Then
        IllegalStateException exception = assertThrows(
            IllegalStateException.class,
            () -> RunUpdate.builder().externalHandle("h2").build().applyTo(submitted)
        );
        assertTrue(exception.getMessage().contains("already assigned"));
    }

    @Test
    void applyTo_BackwardState_ThrowsException() {
        // Given
        WorkflowRun running = RunUpdate.builder().state(RunState.RUNNING).build().applyTo(queued);

        // When & Then
        assertThrows(IllegalStateException.class,
            () -> RunUpdate.builder().state(RunState.QUEUED).build().applyTo(running));
    }

    @Test
    void applyTo_ErrorMessageWithoutErrorState_ThrowsException() {
        // When & Then
        assertThrows(IllegalStateException.class,
            () -> RunUpdate.builder().errorMessage("boom").build().applyTo(queued));
    }

    @Test
    void applyTo_OutputsOnlyOnEntryIntoComplete() {
        // Given
        RunUpdate complete = RunUpdate.builder()
            .state(RunState.COMPLETE)
            .endTime(NOW)
            .outputs(Map.of("result", "s3://out"))
            .build();

        // When
        WorkflowRun updated = complete.applyTo(queued);

        // Then
        assertEquals(Map.of("result", "s3://out"), updated.outputs());
        assertThrows(IllegalStateException.class,
            () -> RunUpdate.builder().state(RunState.RUNNING).outputs(Map.of()).build().applyTo(queued));
    }

    @Test
    void applyTo_Tasks_ReplacedWholesale() {
        // Given
        TaskLog first = new TaskLog("t1", "align", List.of(), null, null, null, null, null, "RUNNING");
        TaskLog second = new TaskLog("t2", "sort", List.of(), null, null, 0, null, null, "COMPLETED");
        WorkflowRun withOne = RunUpdate.builder().tasks(List.of(first)).build().applyTo(queued);

        // When
        WorkflowRun replaced = RunUpdate.builder().tasks(List.of(second)).build().applyTo(withOne);

        // Then
        assertEquals(List.of(second), replaced.tasks());
    }

    @Test
    void applyTo_NextAttemptAt_SetAndCleared() {
        // Given
        WorkflowRun backingOff = RunUpdate.builder()
            .providerFailures(1).nextAttemptAt(NOW.plusSeconds(5)).build().applyTo(queued);

        // When
        WorkflowRun cleared = RunUpdate.builder()
            .providerFailures(0).clearNextAttemptAt().build().applyTo(backingOff);

        // Then
        assertEquals(NOW.plusSeconds(5), backingOff.nextAttemptAt());
        assertNull(cleared.nextAttemptAt());
        assertEquals(0, cleared.providerFailures());
    }
}
