/**
 * In-memory Run Store adapter.
 *
 * <p>Reference implementation of {@link com.ryuqq.wes.core.spi.RunStore} used by the
 * daemon's default wiring and by every engine test.</p>
 *
 * <p><strong>Design Principles:</strong></p>
 * <ul>
 *   <li><strong>Concurrency:</strong> {@link java.util.concurrent.ConcurrentHashMap} compute for
 *       compare-and-set, a concurrent key set for per-run try-locks</li>
 *   <li><strong>Ordering:</strong> creation sequence from an {@link java.util.concurrent.atomic.AtomicLong},
 *       indexed by a {@link java.util.concurrent.ConcurrentSkipListMap}</li>
 * </ul>
 *
 * @see com.ryuqq.wes.core.spi.RunStore
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.wes.adapter.inmemory.store;
