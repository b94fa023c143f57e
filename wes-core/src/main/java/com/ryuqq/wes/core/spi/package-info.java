/**
 * Service Provider Interfaces of the run lifecycle engine.
 *
 * <ul>
 *   <li>{@link com.ryuqq.wes.core.spi.RunStore}: persisted run records, compare-and-set, locks</li>
 *   <li>{@link com.ryuqq.wes.core.spi.ProviderAdapter}: one implementation per execution backend</li>
 *   <li>{@link com.ryuqq.wes.core.spi.StatusMapping}: backend status vocabulary table</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.wes.core.spi;
