/**
 * Runner Adapter Layer - 리컨실 실행 구성요소.
 *
 * <h2>구성요소</h2>
 * <ul>
 *   <li>{@link com.ryuqq.wes.adapter.runner.ReconciliationScheduler} - fan-in 큐 + 고정 워커 풀</li>
 *   <li>{@link com.ryuqq.wes.adapter.runner.StaleRunPoller} - QUEUED 제출 및 stale Run 재확인 루프</li>
 * </ul>
 *
 * <h2>아키텍처 위치</h2>
 * <pre>
 * adapter-notification (NotificationHandler) ─┐
 * adapter-runner (StaleRunPoller) ────────────┼→ ReconciliationScheduler
 * application (LifecycleController.submit) ───┘        ↓
 *                                         application (Reconciler.reconcile)
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.wes.adapter.runner;
