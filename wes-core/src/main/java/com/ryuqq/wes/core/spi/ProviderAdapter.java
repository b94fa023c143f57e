package com.ryuqq.wes.core.spi;

import com.ryuqq.wes.core.error.ProviderRunNotFoundException;
import com.ryuqq.wes.core.error.ProviderSubmissionException;
import com.ryuqq.wes.core.error.ProviderUnavailableException;
import com.ryuqq.wes.core.model.WorkflowRun;

/**
 * Execution backend SPI.
 *
 * <p>One implementation exists per backend (managed execution platform, container
 * workflow service, ...). An adapter translates generic run intent into backend
 * calls and the backend's status vocabulary into {@link com.ryuqq.wes.core.statemachine.RunState}.</p>
 *
 * <p><strong>Failure Classification:</strong></p>
 * <ul>
 *   <li>{@link ProviderUnavailableException}: timeout, rate limit, auth refresh, network failure.
 *       The engine leaves the run state unchanged and retries with backoff.</li>
 *   <li>{@link ProviderSubmissionException}: the backend rejected the workflow or its parameters.</li>
 *   <li>{@link ProviderRunNotFoundException}: the backend does not know the handle.
 *       Never reported as {@link ProviderUnavailableException}.</li>
 * </ul>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>Thread-safe: different runs are reconciled concurrently</li>
 *   <li>No internal retries: the engine owns the retry policy</li>
 *   <li>Unmapped backend statuses map to UNKNOWN through {@link #statusMapping()}</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface ProviderAdapter {

    /**
     * Registry key of this backend (e.g. "sevenbridges").
     *
     * @return provider type
     */
    String providerType();

    /**
     * Submits the run to the backend.
     *
     * @param run the QUEUED run, carrying its submission spec
     * @return the backend-assigned external handle
     * @throws ProviderSubmissionException if the backend rejects the submission
     * @throws ProviderUnavailableException on transient failure
     */
    String submit(WorkflowRun run) throws ProviderSubmissionException, ProviderUnavailableException;

    /**
     * Reads the backend status of a submitted run.
     *
     * @param externalHandle handle returned by {@link #submit(WorkflowRun)}
     * @return mapped status, outputs and tasks
     * @throws ProviderUnavailableException on transient failure
     * @throws ProviderRunNotFoundException if the backend does not know the handle
     */
    ProviderStatus getStatus(String externalHandle)
        throws ProviderUnavailableException, ProviderRunNotFoundException;

    /**
     * Requests cancellation of a submitted run.
     *
     * @param externalHandle handle returned by {@link #submit(WorkflowRun)}
     * @return true if the backend accepted the request
     * @throws ProviderUnavailableException on transient failure
     */
    boolean cancel(String externalHandle) throws ProviderUnavailableException;

    /**
     * Static table from the backend's native vocabulary to canonical states.
     *
     * @return the status mapping
     */
    StatusMapping statusMapping();
}
