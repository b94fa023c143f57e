package com.ryuqq.wes.application.trigger.noop;

import com.ryuqq.wes.application.trigger.RunNotifier;
import com.ryuqq.wes.core.model.RunId;

/**
 * 아무것도 하지 않는 RunNotifier.
 *
 * <p>알림 채널 없이 폴링 루프만으로 동작하는 구성에서 사용합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class NoOpRunNotifier implements RunNotifier {

    public static final NoOpRunNotifier INSTANCE = new NoOpRunNotifier();

    private NoOpRunNotifier() {
    }

    @Override
    public void announce(RunId runId) {
        // no-op
    }
}
