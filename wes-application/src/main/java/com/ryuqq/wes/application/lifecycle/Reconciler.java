package com.ryuqq.wes.application.lifecycle;

import com.ryuqq.wes.core.model.RunId;

/**
 * 리컨실 진입점.
 *
 * <p>알림 채널과 폴링 루프 두 트리거가 모두 이 메서드로 모입니다.
 * 멱등하며, 같은 Run에 대한 동시 호출 중 하나는 즉시 no-op으로 반환됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface Reconciler {

    /**
     * Provider 측 상태로 Run을 한 번 갱신합니다.
     *
     * <p>예외를 던지지 않고 결과를 {@link ReconcileOutcome}으로 보고합니다.</p>
     *
     * @param runId Run ID
     * @return 이번 패스의 결과
     */
    ReconcileOutcome reconcile(RunId runId);
}
