package com.ryuqq.wes.testkit.contract;

import com.ryuqq.wes.core.error.InvalidPageTokenException;
import com.ryuqq.wes.core.error.RunNotFoundException;
import com.ryuqq.wes.core.model.RunFilter;
import com.ryuqq.wes.core.model.RunId;
import com.ryuqq.wes.core.model.RunUpdate;
import com.ryuqq.wes.core.model.WorkflowRun;
import com.ryuqq.wes.core.pagination.Page;
import com.ryuqq.wes.core.spi.RunStore;
import com.ryuqq.wes.core.statemachine.RunState;
import com.ryuqq.wes.testkit.fixture.RunFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Contract Test for {@link RunStore} implementations.
 *
 * <p>Every RunStore adapter extends this class and supplies a fresh store.</p>
 *
 * <p><strong>Test Scenarios:</strong></p>
 * <ul>
 *   <li>Creation sequence and lookup</li>
 *   <li>Compare-and-set atomicity</li>
 *   <li>Cursor pagination round trip</li>
 *   <li>Poll-loop scans</li>
 *   <li>Non-blocking per-run locks</li>
 * </ul>
 *
 * <pre>
 * class MyRunStoreContractTest extends RunStoreContractTest {
 *     {@literal @}Override
 *     protected RunStore createStore() {
 *         return new MyRunStore();
 *     }
 * }
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public abstract class RunStoreContractTest {

    protected static final String PROVIDER = "mockA";

    protected RunStore store;

    /**
     * Creates the store under test.
     *
     * @return an empty store
     */
    protected abstract RunStore createStore();

    @BeforeEach
    void setUpStore() {
        store = createStore();
    }

    // ============================================================
    // create / find
    // ============================================================

    @Test
    void create_AssignsIncreasingSequence() {
        // when
        WorkflowRun first = store.create(RunFixtures.queuedRun(PROVIDER));
        WorkflowRun second = store.create(RunFixtures.queuedRun(PROVIDER));

        // then
        assertThat(first.sequence()).isPositive();
        assertThat(second.sequence()).isGreaterThan(first.sequence());
        assertThat(store.find(first.runId())).contains(first);
    }

    @Test
    void create_DuplicateRunId_Fails() {
        // given
        WorkflowRun run = RunFixtures.queuedRun(PROVIDER);
        store.create(run);

        // when & then
        assertThatThrownBy(() -> store.create(run)).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void find_UnknownRun_ReturnsEmpty() {
        assertThat(store.find(RunId.generate())).isEmpty();
    }

    // ============================================================
    // compareAndSet
    // ============================================================

    @Test
    void compareAndSet_ExpectedStateMatches_CommitsAllFields() {
        // given
        WorkflowRun run = store.create(RunFixtures.queuedRun(PROVIDER));
        Instant now = RunFixtures.EPOCH.plusSeconds(10);
        RunUpdate update = RunUpdate.builder()
            .state(RunState.INITIALIZING)
            .externalHandle("h1")
            .startTime(now)
            .lastReconciledAt(now)
            .build();

        // when
        boolean committed = store.compareAndSet(run.runId(), RunState.QUEUED, update);

        // then
        WorkflowRun stored = store.find(run.runId()).orElseThrow();
        assertThat(committed).isTrue();
        assertThat(stored.state()).isEqualTo(RunState.INITIALIZING);
        assertThat(stored.externalHandle()).isEqualTo("h1");
        assertThat(stored.startTime()).isEqualTo(now);
        assertThat(stored.lastReconciledAt()).isEqualTo(now);
        assertThat(stored.sequence()).isEqualTo(run.sequence());
    }

    @Test
    void compareAndSet_StateMoved_WritesNothing() {
        // given
        WorkflowRun run = store.create(RunFixtures.queuedRun(PROVIDER));
        RunUpdate update = RunUpdate.builder()
            .state(RunState.RUNNING)
            .lastReconciledAt(RunFixtures.EPOCH.plusSeconds(1))
            .build();

        // when
        boolean committed = store.compareAndSet(run.runId(), RunState.INITIALIZING, update);

        // then
        assertThat(committed).isFalse();
        assertThat(store.find(run.runId())).contains(run);
    }

    @Test
    void compareAndSet_InvariantViolation_LeavesRecordUntouched() {
        // given
        WorkflowRun run = store.create(RunFixtures.queuedRun(PROVIDER));
        store.compareAndSet(run.runId(), RunState.QUEUED,
            RunUpdate.builder().state(RunState.COMPLETE).build());
        WorkflowRun terminal = store.find(run.runId()).orElseThrow();

        // when & then
        assertThatThrownBy(() -> store.compareAndSet(run.runId(), RunState.COMPLETE,
            RunUpdate.builder().state(RunState.RUNNING).build()))
            .isInstanceOf(IllegalStateException.class);
        assertThat(store.find(run.runId())).contains(terminal);
    }

    @Test
    void compareAndSet_UnknownRun_ThrowsRunNotFound() {
        assertThatThrownBy(() -> store.compareAndSet(RunId.generate(), RunState.QUEUED,
            RunUpdate.builder().build()))
            .isInstanceOf(RunNotFoundException.class);
    }

    @Test
    void compareAndSet_ConcurrentWriters_OnlyOneWins() throws InterruptedException {
        // given
        WorkflowRun run = store.create(RunFixtures.queuedRun(PROVIDER));
        int writers = 8;
        ExecutorService pool = Executors.newFixedThreadPool(writers);
        CountDownLatch start = new CountDownLatch(1);
        AtomicInteger wins = new AtomicInteger();

        // when
        for (int i = 0; i < writers; i++) {
            String handle = "h" + i;
            pool.submit(() -> {
                start.await();
                if (store.compareAndSet(run.runId(), RunState.QUEUED, RunUpdate.builder()
                    .state(RunState.INITIALIZING).externalHandle(handle).build())) {
                    wins.incrementAndGet();
                }
                return null;
            });
        }
        start.countDown();
        pool.shutdown();
        assertThat(pool.awaitTermination(10, TimeUnit.SECONDS)).isTrue();

        // then
        assertThat(wins.get()).isEqualTo(1);
        assertThat(store.find(run.runId()).orElseThrow().externalHandle()).startsWith("h");
    }

    // ============================================================
    // list
    // ============================================================

    @Test
    void list_PageRoundTrip_VisitsEveryRunExactlyOnce() {
        // given
        int pageSize = 4;
        int total = pageSize * 3 + 1;
        Set<RunId> created = new HashSet<>();
        for (int i = 0; i < total; i++) {
            created.add(store.create(RunFixtures.queuedRun(PROVIDER)).runId());
        }

        // when
        List<RunId> visited = new ArrayList<>();
        String token = null;
        int pages = 0;
        do {
            Page<WorkflowRun> page = store.list(RunFilter.all(), token, pageSize);
            assertThat(page.items()).hasSizeLessThanOrEqualTo(pageSize);
            page.items().forEach(run -> visited.add(run.runId()));
            token = page.nextPageToken();
            pages++;
        } while (token != null);

        // then
        assertThat(pages).isEqualTo(4);
        assertThat(visited).hasSize(total).doesNotHaveDuplicates();
        assertThat(new HashSet<>(visited)).isEqualTo(created);
    }

    @Test
    void list_ExactMultipleOfPageSize_LastPageHasNoToken() {
        // given
        for (int i = 0; i < 6; i++) {
            store.create(RunFixtures.queuedRun(PROVIDER));
        }

        // when
        Page<WorkflowRun> first = store.list(RunFilter.all(), null, 3);
        Page<WorkflowRun> second = store.list(RunFilter.all(), first.nextPageToken(), 3);

        // then
        assertThat(first.nextPageToken()).isNotNull();
        assertThat(second.items()).hasSize(3);
        assertThat(second.nextPageToken()).isNull();
    }

    @Test
    void list_NewestFirst_AndStableUnderConcurrentCreation() {
        // given
        List<WorkflowRun> runs = new ArrayList<>();
        for (int i = 0; i < 5; i++) {
            runs.add(store.create(RunFixtures.queuedRun(PROVIDER)));
        }
        Page<WorkflowRun> first = store.list(RunFilter.all(), null, 2);

        // when
        store.create(RunFixtures.queuedRun(PROVIDER));
        Page<WorkflowRun> second = store.list(RunFilter.all(), first.nextPageToken(), 2);

        // then
        assertThat(first.items()).extracting(WorkflowRun::runId)
            .containsExactly(runs.get(4).runId(), runs.get(3).runId());
        assertThat(second.items()).extracting(WorkflowRun::runId)
            .containsExactly(runs.get(2).runId(), runs.get(1).runId());
    }

    @Test
    void list_Filter_AppliesStateAndTags() {
        // given
        WorkflowRun queued = store.create(RunFixtures.queuedRun(PROVIDER));
        WorkflowRun running = store.create(RunFixtures.queuedRun(PROVIDER));
        store.compareAndSet(running.runId(), RunState.QUEUED,
            RunUpdate.builder().state(RunState.RUNNING).build());

        // when
        Page<WorkflowRun> onlyRunning = store.list(
            RunFilter.all().withStates(Set.of(RunState.RUNNING)), null, 10);
        Page<WorkflowRun> byTag = store.list(
            RunFilter.all().withTags(Map.of("project", "test")), null, 10);
        Page<WorkflowRun> noMatch = store.list(
            RunFilter.all().withTags(Map.of("project", "other")), null, 10);

        // then
        assertThat(onlyRunning.items()).extracting(WorkflowRun::runId).containsExactly(running.runId());
        assertThat(byTag.items()).extracting(WorkflowRun::runId)
            .containsExactly(running.runId(), queued.runId());
        assertThat(noMatch.items()).isEmpty();
    }

    @Test
    void list_GarbageToken_FailsInsteadOfRestarting() {
        // given
        store.create(RunFixtures.queuedRun(PROVIDER));

        // when & then
        assertThatThrownBy(() -> store.list(RunFilter.all(), "%%%garbage", 10))
            .isInstanceOf(InvalidPageTokenException.class);
    }

    // ============================================================
    // scans
    // ============================================================

    @Test
    void scanQueued_ReturnsOnlyQueuedOldestFirst() {
        // given
        WorkflowRun first = store.create(RunFixtures.queuedRun(PROVIDER));
        WorkflowRun submitted = store.create(RunFixtures.queuedRun(PROVIDER));
        WorkflowRun third = store.create(RunFixtures.queuedRun(PROVIDER));
        store.compareAndSet(submitted.runId(), RunState.QUEUED, RunUpdate.builder()
            .state(RunState.INITIALIZING).externalHandle("h1").build());

        // when & then
        assertThat(store.scanQueued(10)).containsExactly(first.runId(), third.runId());
        assertThat(store.scanQueued(1)).containsExactly(first.runId());
    }

    @Test
    void scanStale_SkipsTerminalAndRecentlyReconciled() {
        // given
        Instant base = RunFixtures.EPOCH;
        WorkflowRun stale = store.create(RunFixtures.queuedRun(RunId.generate(), PROVIDER, base));
        WorkflowRun fresh = store.create(RunFixtures.queuedRun(RunId.generate(), PROVIDER, base));
        WorkflowRun done = store.create(RunFixtures.queuedRun(RunId.generate(), PROVIDER, base));
        store.compareAndSet(fresh.runId(), RunState.QUEUED,
            RunUpdate.builder().lastReconciledAt(base.plusSeconds(600)).build());
        store.compareAndSet(done.runId(), RunState.QUEUED,
            RunUpdate.builder().state(RunState.CANCELED).build());

        // when
        List<RunId> result = store.scanStale(base.plusSeconds(300), 10);

        // then
        assertThat(result).containsExactly(stale.runId());
    }

    @Test
    void countActive_CountsSlotHoldingStates() {
        // given
        WorkflowRun running = store.create(RunFixtures.queuedRun(PROVIDER));
        WorkflowRun canceling = store.create(RunFixtures.queuedRun(PROVIDER));
        store.create(RunFixtures.queuedRun(PROVIDER));
        store.compareAndSet(running.runId(), RunState.QUEUED,
            RunUpdate.builder().state(RunState.RUNNING).build());
        store.compareAndSet(canceling.runId(), RunState.QUEUED,
            RunUpdate.builder().state(RunState.CANCELING).build());

        // when & then
        assertThat(store.countActive()).isEqualTo(2);
    }

    // ============================================================
    // locks
    // ============================================================

    @Test
    void tryLock_HeldLock_FailsFastUntilReleased() {
        // given
        RunId runId = store.create(RunFixtures.queuedRun(PROVIDER)).runId();

        // when
        boolean first = store.tryLock(runId);
        boolean second = store.tryLock(runId);
        store.release(runId);
        boolean third = store.tryLock(runId);

        // then
        assertThat(first).isTrue();
        assertThat(second).isFalse();
        assertThat(third).isTrue();
    }

    @Test
    void tryLock_DifferentRuns_AreIndependent() {
        // given
        RunId a = store.create(RunFixtures.queuedRun(PROVIDER)).runId();
        RunId b = store.create(RunFixtures.queuedRun(PROVIDER)).runId();

        // when & then
        assertThat(store.tryLock(a)).isTrue();
        assertThat(store.tryLock(b)).isTrue();
    }
}
