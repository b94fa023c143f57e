package com.ryuqq.wes.core.statemachine;

/**
 * Workflow Run의 정규(canonical) 상태.
 *
 * <p>Provider마다 다른 상태 어휘를 엔진 고유의 상태로 통일합니다.
 * GA4GH WES State 값과 이름이 동일합니다.</p>
 *
 * <p><strong>상태 분류:</strong></p>
 * <ul>
 *   <li>종료 상태: COMPLETE, EXECUTOR_ERROR, SYSTEM_ERROR, CANCELED</li>
 *   <li>활성 상태 (동시 실행 한도에 포함): INITIALIZING, RUNNING, PAUSED, CANCELING</li>
 *   <li>UNKNOWN: Provider 상태를 매핑할 수 없을 때의 읽기 전용 투영.
 *       Controller가 저장하는 상태가 아닙니다.</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum RunState {

    /**
     * 제출 접수됨. 아직 Provider에 제출되지 않음.
     */
    QUEUED,

    /**
     * Provider가 제출을 수락하고 실행을 준비 중.
     */
    INITIALIZING,

    /**
     * Provider에서 실행 중.
     */
    RUNNING,

    /**
     * Provider에서 일시 정지됨 (Provider 의존).
     */
    PAUSED,

    /**
     * 정상 완료 (종료 상태).
     */
    COMPLETE,

    /**
     * 워크플로우 자체 실패 (종료 상태).
     */
    EXECUTOR_ERROR,

    /**
     * 엔진 또는 Provider 시스템 오류 (종료 상태).
     */
    SYSTEM_ERROR,

    /**
     * 취소 요청됨. Provider 확인 대기 중.
     */
    CANCELING,

    /**
     * 취소 완료 (종료 상태).
     */
    CANCELED,

    /**
     * 매핑 불가한 Provider 상태.
     */
    UNKNOWN;

    /**
     * 종료 상태 여부 확인.
     *
     * @return COMPLETE, EXECUTOR_ERROR, SYSTEM_ERROR, CANCELED인 경우 true
     */
    public boolean isTerminal() {
        return this == COMPLETE || this == EXECUTOR_ERROR || this == SYSTEM_ERROR || this == CANCELED;
    }

    /**
     * Provider 측 실행 슬롯을 점유하는 상태인지 확인.
     *
     * @return INITIALIZING, RUNNING, PAUSED, CANCELING인 경우 true
     */
    public boolean isActive() {
        return this == INITIALIZING || this == RUNNING || this == PAUSED || this == CANCELING;
    }

    /**
     * cancel 요청이 허용되는 상태인지 확인.
     *
     * @return QUEUED, INITIALIZING, RUNNING, PAUSED인 경우 true
     */
    public boolean isCancelable() {
        return this == QUEUED || this == INITIALIZING || this == RUNNING || this == PAUSED;
    }
}
