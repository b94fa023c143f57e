/**
 * Shared run fixtures and a manually advanced clock.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.wes.testkit.fixture;
