package com.ryuqq.wes.adapter.inmemory.store;

import com.ryuqq.wes.core.model.RunFilter;
import com.ryuqq.wes.testkit.fixture.RunFixtures;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * InMemoryRunStore 고유 동작 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class InMemoryRunStoreTest {

    private final InMemoryRunStore store = new InMemoryRunStore();

    @Test
    void clear_RemovesRunsAndLocks() {
        // given
        var run = store.create(RunFixtures.queuedRun("mockA"));
        store.tryLock(run.runId());

        // when
        store.clear();

        // then
        assertThat(store.size()).isZero();
        assertThat(store.find(run.runId())).isEmpty();
        assertThat(store.tryLock(run.runId())).isTrue();
    }

    @Test
    void list_NonPositivePageSize_Rejected() {
        assertThatThrownBy(() -> store.list(RunFilter.all(), null, 0))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
