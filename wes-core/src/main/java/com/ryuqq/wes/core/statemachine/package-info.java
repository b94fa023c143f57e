/**
 * Run state machine package.
 *
 * <p>This package defines the canonical run states and the forward-only
 * transition rules every stored run must obey.</p>
 *
 * <h2>Components</h2>
 * <ul>
 *   <li>{@link com.ryuqq.wes.core.statemachine.RunState} - Canonical run lifecycle states (enum)</li>
 *   <li>{@link com.ryuqq.wes.core.statemachine.StateTransition} - Forward-only transition checks</li>
 * </ul>
 *
 * <h2>State Graph</h2>
 * <pre>
 * QUEUED → INITIALIZING → RUNNING → {COMPLETE | EXECUTOR_ERROR | SYSTEM_ERROR | CANCELING}
 * RUNNING ⇄ PAUSED
 * CANCELING → CANCELED (or any terminal state reported by the backend)
 * any non-terminal → SYSTEM_ERROR
 *
 * Forbidden:
 * - terminal → *
 * - * → UNKNOWN (read-only projection)
 * - Backward transitions (e.g., RUNNING → INITIALIZING)
 * </pre>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.wes.core.statemachine;
