/**
 * Reusable SPI contract tests.
 *
 * <p>{@link com.ryuqq.wes.testkit.contract.RunStoreContractTest} defines the behavior every
 * {@link com.ryuqq.wes.core.spi.RunStore} adapter must show.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.wes.testkit.contract;
