package com.ryuqq.wes.adapter.inmemory.store;

import com.ryuqq.wes.core.error.RunNotFoundException;
import com.ryuqq.wes.core.model.RunFilter;
import com.ryuqq.wes.core.model.RunId;
import com.ryuqq.wes.core.model.RunUpdate;
import com.ryuqq.wes.core.model.WorkflowRun;
import com.ryuqq.wes.core.pagination.Page;
import com.ryuqq.wes.core.pagination.PageTokenCodec;
import com.ryuqq.wes.core.spi.RunStore;
import com.ryuqq.wes.core.statemachine.RunState;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

/**
 * In-memory implementation of {@link RunStore} SPI for testing and reference purposes.
 *
 * <p><strong>Data Structures:</strong></p>
 * <ul>
 *   <li><strong>runs:</strong> ConcurrentHashMap&lt;RunId, WorkflowRun&gt; - Run records (O(1) access)</li>
 *   <li><strong>bySequence:</strong> ConcurrentSkipListMap&lt;Long, RunId&gt; - Creation order index for cursor listing</li>
 *   <li><strong>locks:</strong> concurrent key set of RunIds whose reconciliation lock is held</li>
 * </ul>
 *
 * <p><strong>Atomicity:</strong> compareAndSet runs inside {@link ConcurrentHashMap#computeIfPresent},
 * so the state check and the replacement of the record happen under the same bin lock.
 * An update that violates a run invariant throws before anything is replaced.</p>
 *
 * <p><strong>Limitations:</strong></p>
 * <ul>
 *   <li>Data lost on process restart</li>
 *   <li>Locks are process-local</li>
 * </ul>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * RunStore store = new InMemoryRunStore();
 * WorkflowRun stored = store.create(WorkflowRun.queued(runId, spec, "sevenbridges", now));
 *
 * if (store.tryLock(runId)) {
 *     try {
 *         store.compareAndSet(runId, RunState.QUEUED, update);
 *     } finally {
 *         store.release(runId);
 *     }
 * }
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class InMemoryRunStore implements RunStore {

    private final ConcurrentHashMap<RunId, WorkflowRun> runs;
    private final ConcurrentSkipListMap<Long, RunId> bySequence;
    private final Set<RunId> locks;
    private final AtomicLong sequence;
    private final PageTokenCodec tokenCodec;

    /**
     * Creates a new InMemoryRunStore with empty storage.
     */
    public InMemoryRunStore() {
        this.runs = new ConcurrentHashMap<>();
        this.bySequence = new ConcurrentSkipListMap<>();
        this.locks = ConcurrentHashMap.newKeySet();
        this.sequence = new AtomicLong();
        this.tokenCodec = new PageTokenCodec();
    }

    @Override
    public WorkflowRun create(WorkflowRun run) {
        if (run == null) {
            throw new IllegalArgumentException("run cannot be null");
        }

        WorkflowRun stored = run.withSequence(sequence.incrementAndGet());
        WorkflowRun existing = runs.putIfAbsent(run.runId(), stored);
        if (existing != null) {
            throw new IllegalStateException("Run already exists: " + run.runId());
        }
        bySequence.put(stored.sequence(), stored.runId());
        return stored;
    }

    @Override
    public Optional<WorkflowRun> find(RunId runId) {
        if (runId == null) {
            throw new IllegalArgumentException("runId cannot be null");
        }
        return Optional.ofNullable(runs.get(runId));
    }

    /**
     * {@inheritDoc}
     *
     * <p><strong>Implementation Notes:</strong></p>
     * <ul>
     *   <li>State mismatch leaves the record untouched and returns false</li>
     *   <li>{@link RunUpdate#applyTo(WorkflowRun)} runs inside the map's atomic compute</li>
     * </ul>
     */
    @Override
    public boolean compareAndSet(RunId runId, RunState expectedState, RunUpdate update) {
        if (runId == null) {
            throw new IllegalArgumentException("runId cannot be null");
        }
        if (expectedState == null) {
            throw new IllegalArgumentException("expectedState cannot be null");
        }
        if (update == null) {
            throw new IllegalArgumentException("update cannot be null");
        }

        AtomicBoolean applied = new AtomicBoolean(false);
        WorkflowRun result = runs.computeIfPresent(runId, (id, current) -> {
            if (current.state() != expectedState) {
                return current;
            }
            WorkflowRun next = update.applyTo(current);
            applied.set(true);
            return next;
        });

        if (result == null) {
            throw new RunNotFoundException(runId);
        }
        return applied.get();
    }

    /**
     * {@inheritDoc}
     *
     * <p><strong>Implementation Notes:</strong></p>
     * <ul>
     *   <li>Walks the sequence index newest first, starting below the token's sequence</li>
     *   <li>Collects pageSize + 1 matches to decide whether a next page exists</li>
     * </ul>
     */
    @Override
    public Page<WorkflowRun> list(RunFilter filter, String pageToken, int pageSize) {
        if (filter == null) {
            throw new IllegalArgumentException("filter cannot be null");
        }
        if (pageSize <= 0) {
            throw new IllegalArgumentException("pageSize must be positive, but was: " + pageSize);
        }

        NavigableMap<Long, RunId> window = pageToken == null
            ? bySequence.descendingMap()
            : bySequence.headMap(tokenCodec.decodeSequence(pageToken), false).descendingMap();

        List<WorkflowRun> matched = new ArrayList<>(pageSize + 1);
        for (Map.Entry<Long, RunId> entry : window.entrySet()) {
            WorkflowRun run = runs.get(entry.getValue());
            if (run != null && filter.matches(run)) {
                matched.add(run);
                if (matched.size() > pageSize) {
                    break;
                }
            }
        }

        if (matched.size() <= pageSize) {
            return new Page<>(matched, null);
        }
        List<WorkflowRun> items = matched.subList(0, pageSize);
        String nextPageToken = tokenCodec.encodeSequence(items.get(pageSize - 1).sequence());
        return new Page<>(items, nextPageToken);
    }

    @Override
    public List<RunId> scanQueued(int limit) {
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be positive, but was: " + limit);
        }

        return runs.values().stream()
            .filter(run -> run.state() == RunState.QUEUED)
            .sorted(Comparator.comparingLong(WorkflowRun::sequence))
            .limit(limit)
            .map(WorkflowRun::runId)
            .collect(Collectors.toList());
    }

    @Override
    public List<RunId> scanStale(Instant reconciledBefore, int limit) {
        if (reconciledBefore == null) {
            throw new IllegalArgumentException("reconciledBefore cannot be null");
        }
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be positive, but was: " + limit);
        }

        return runs.values().stream()
            .filter(run -> !run.isTerminal())
            .filter(run -> run.lastTouchedAt().isBefore(reconciledBefore))
            .sorted(Comparator.comparing(WorkflowRun::lastTouchedAt))
            .limit(limit)
            .map(WorkflowRun::runId)
            .collect(Collectors.toList());
    }

    @Override
    public int countActive() {
        return (int) runs.values().stream()
            .filter(run -> run.state().isActive())
            .count();
    }

    @Override
    public boolean tryLock(RunId runId) {
        if (runId == null) {
            throw new IllegalArgumentException("runId cannot be null");
        }
        return locks.add(runId);
    }

    @Override
    public void release(RunId runId) {
        if (runId == null) {
            throw new IllegalArgumentException("runId cannot be null");
        }
        locks.remove(runId);
    }

    /**
     * Number of stored runs.
     *
     * @return run count
     */
    public int size() {
        return runs.size();
    }

    /**
     * Clears all stored data.
     *
     * <p>Useful for test cleanup between test cases.</p>
     */
    public void clear() {
        runs.clear();
        bySequence.clear();
        locks.clear();
    }
}
