/**
 * Reconciliation trigger seams.
 *
 * <p>{@link com.ryuqq.wes.application.trigger.RunNotifier} is the outbound side used by
 * submit and cancel; {@link com.ryuqq.wes.application.trigger.ReconcileQueue} is the
 * inbound fan-in shared by the notification intake and the poll loop.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.wes.application.trigger;
