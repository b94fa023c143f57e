/**
 * REST provider adapters.
 *
 * <p>{@link com.ryuqq.wes.adapter.provider.AbstractHttpProviderAdapter} owns the HTTP plumbing and the
 * transient/permanent classification; each backend supplies its auth header, request bodies and
 * status vocabulary.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.wes.adapter.provider;
