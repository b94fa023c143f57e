/**
 * Run lifecycle 제어.
 *
 * <p>요청 계층과 리컨실 계층이 같은 {@link com.ryuqq.wes.core.spi.RunStore}를 공유합니다.
 * 요청 계층은 Provider를 호출하지 않고, 리컨실 계층만 Run 단위 잠금을 잡고 Provider를 호출합니다.</p>
 *
 * <ul>
 *   <li>{@link com.ryuqq.wes.application.lifecycle.RunLifecycle}: submit, status, cancel, list</li>
 *   <li>{@link com.ryuqq.wes.application.lifecycle.Reconciler}: Run 하나의 리컨실 패스</li>
 *   <li>{@link com.ryuqq.wes.application.lifecycle.LifecycleController}: 두 계층의 구현</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.wes.application.lifecycle;
