package com.ryuqq.wes.application.trigger;

import com.ryuqq.wes.core.model.RunId;

/**
 * 리컨실 작업 큐 (알림 수신부와 폴링 루프가 공유하는 fan-in 채널).
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface ReconcileQueue {

    /**
     * Run을 리컨실 대기열에 넣습니다.
     *
     * <p>이미 대기 중인 Run은 중복으로 넣지 않습니다. 큐가 가득 차면 버려지며,
     * 다음 폴링 주기에 다시 들어옵니다.</p>
     *
     * @param runId Run ID
     * @return 새로 대기열에 들어갔거나 이미 대기 중이면 true, 버려졌으면 false
     */
    boolean enqueue(RunId runId);
}
