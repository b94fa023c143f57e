package com.ryuqq.wes.core.spi;

import com.ryuqq.wes.core.model.RunFilter;
import com.ryuqq.wes.core.model.RunId;
import com.ryuqq.wes.core.model.RunUpdate;
import com.ryuqq.wes.core.model.WorkflowRun;
import com.ryuqq.wes.core.pagination.Page;
import com.ryuqq.wes.core.statemachine.RunState;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Persistent Storage SPI for workflow run records.
 *
 * <p>The lifecycle engine never touches a concrete storage engine; every read,
 * write and lock goes through this interface.</p>
 *
 * <p><strong>Responsibilities:</strong></p>
 * <ul>
 *   <li>Run creation with a strictly increasing creation sequence</li>
 *   <li>All-or-nothing state transitions through compare-and-set</li>
 *   <li>Cursor-based listing over the creation sequence</li>
 *   <li>Poll-loop scans (QUEUED runs, stale non-terminal runs, active count)</li>
 *   <li>Non-blocking per-run exclusive locks</li>
 * </ul>
 *
 * <p><strong>Compare-and-Set Pattern:</strong></p>
 * <pre>
 * 1. find(runId)                          → snapshot in state S
 * 2. build RunUpdate from provider reply
 * 3. compareAndSet(runId, S, update)      → true: committed / false: state moved, nothing written
 * </pre>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>Atomicity: compareAndSet writes every field of the update or none of them</li>
 *   <li>Thread-safe: All methods must be safely callable from multiple threads</li>
 *   <li>Failures of the backing storage are raised as
 *       {@link com.ryuqq.wes.core.error.RunStoreException}</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface RunStore {

    /**
     * Persists a new run and assigns its creation sequence.
     *
     * @param run the run to create (sequence is ignored)
     * @return the stored run carrying its assigned sequence
     * @throws IllegalArgumentException if run is null
     * @throws IllegalStateException if a run with the same id already exists
     */
    WorkflowRun create(WorkflowRun run);

    /**
     * Retrieves a run by id.
     *
     * @param runId the run ID
     * @return the stored run, or empty if none exists
     * @throws IllegalArgumentException if runId is null
     */
    Optional<WorkflowRun> find(RunId runId);

    /**
     * Applies an update only if the stored state still equals {@code expectedState}.
     *
     * <p>The check and the write happen atomically. When the stored state differs,
     * nothing is written and {@code false} is returned.</p>
     *
     * @param runId the run ID
     * @param expectedState the state the caller observed
     * @param update the change set to apply
     * @return true if the update was committed
     * @throws IllegalArgumentException if any argument is null
     * @throws IllegalStateException if the update violates a run invariant
     * @throws com.ryuqq.wes.core.error.RunNotFoundException if the run does not exist
     */
    boolean compareAndSet(RunId runId, RunState expectedState, RunUpdate update);

    /**
     * Lists runs newest first.
     *
     * <p>Implementations fetch {@code pageSize + 1} records and emit a next page token
     * only when the extra record existed. The token encodes the last sequence returned,
     * so runs created after the first page never shift later pages.</p>
     *
     * @param filter listing criteria
     * @param pageToken token from a previous page, or null for the first page
     * @param pageSize maximum number of runs to return (positive)
     * @return the page of runs
     * @throws com.ryuqq.wes.core.error.InvalidPageTokenException if the token cannot be decoded
     */
    Page<WorkflowRun> list(RunFilter filter, String pageToken, int pageSize);

    /**
     * Scans QUEUED runs, oldest first.
     *
     * @param limit maximum number of run ids
     * @return QUEUED run ids
     */
    List<RunId> scanQueued(int limit);

    /**
     * Scans non-terminal runs not reconciled since {@code reconciledBefore}.
     *
     * <p>Runs that were never reconciled are compared by their creation time.</p>
     *
     * @param reconciledBefore staleness threshold
     * @param limit maximum number of run ids
     * @return stale run ids, least recently reconciled first
     */
    List<RunId> scanStale(Instant reconciledBefore, int limit);

    /**
     * Counts runs in an active state (INITIALIZING, RUNNING, PAUSED, CANCELING).
     *
     * @return number of active runs
     */
    int countActive();

    /**
     * Tries to acquire the exclusive per-run lock without blocking.
     *
     * @param runId the run ID
     * @return true if the lock was acquired, false if another holder owns it
     */
    boolean tryLock(RunId runId);

    /**
     * Releases a lock acquired by {@link #tryLock(RunId)}.
     *
     * @param runId the run ID
     */
    void release(RunId runId);
}
