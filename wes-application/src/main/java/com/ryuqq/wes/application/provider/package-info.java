/**
 * Provider resolution and call bounding.
 *
 * <ul>
 *   <li>{@link com.ryuqq.wes.application.provider.ProviderRegistry}: string key to adapter,
 *       validated at startup</li>
 *   <li>{@link com.ryuqq.wes.application.provider.TimeLimitedProviderAdapter}: explicit
 *       per-call timeout, timeouts classified as transient</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.wes.application.provider;
