/**
 * Cursor-based pagination.
 *
 * <p>Tokens are opaque positions over a stable ordering key (the creation sequence
 * for runs), never offsets re-derived from a mutable sort order.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.wes.core.pagination;
