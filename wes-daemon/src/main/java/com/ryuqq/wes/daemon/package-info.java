/**
 * Daemon composition root: environment settings, engine wiring and the process entry point.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.wes.daemon;
