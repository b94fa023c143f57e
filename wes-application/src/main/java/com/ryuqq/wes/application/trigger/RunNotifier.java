package com.ryuqq.wes.application.trigger;

import com.ryuqq.wes.core.model.RunId;

/**
 * "이 Run을 지금 리컨실해 달라"는 알림을 보내는 채널.
 *
 * <p>제출 및 취소 경로가 사용합니다. 전달은 best-effort이며,
 * 실패해도 폴링 루프가 결국 Run을 처리합니다.</p>
 *
 * <p><strong>구현 요구사항:</strong></p>
 * <ul>
 *   <li>호출자를 오래 막지 않을 것 (짧은 타임아웃)</li>
 *   <li>실패는 로그로 남기고 예외를 던지지 않을 것</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface RunNotifier {

    /**
     * Run을 리컨실 대상으로 알립니다.
     *
     * @param runId Run ID
     */
    void announce(RunId runId);
}
