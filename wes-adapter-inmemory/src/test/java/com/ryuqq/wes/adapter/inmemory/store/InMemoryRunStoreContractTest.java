package com.ryuqq.wes.adapter.inmemory.store;

import com.ryuqq.wes.core.spi.RunStore;
import com.ryuqq.wes.testkit.contract.RunStoreContractTest;

/**
 * Contract Tests for {@link InMemoryRunStore}.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class InMemoryRunStoreContractTest extends RunStoreContractTest {

    @Override
    protected RunStore createStore() {
        return new InMemoryRunStore();
    }
}
