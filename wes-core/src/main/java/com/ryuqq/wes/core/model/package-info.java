/**
 * Run domain model.
 *
 * <p><strong>Main Components:</strong></p>
 * <ul>
 *   <li>{@link com.ryuqq.wes.core.model.RunId}: Opaque, immutable run identifier</li>
 *   <li>{@link com.ryuqq.wes.core.model.SubmissionSpec}: Caller-supplied workflow parameters</li>
 *   <li>{@link com.ryuqq.wes.core.model.WorkflowRun}: Immutable persisted run record</li>
 *   <li>{@link com.ryuqq.wes.core.model.TaskLog}: Provider-reported sub-unit of a run</li>
 *   <li>{@link com.ryuqq.wes.core.model.RunUpdate}: All-or-nothing change set of one reconciliation pass</li>
 *   <li>{@link com.ryuqq.wes.core.model.RunFilter}: Listing criteria</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.wes.core.model;
