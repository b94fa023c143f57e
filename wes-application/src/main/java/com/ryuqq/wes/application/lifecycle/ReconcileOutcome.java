package com.ryuqq.wes.application.lifecycle;

/**
 * 리컨실 한 패스의 결과.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum ReconcileOutcome {

    /** 다른 워커가 lock을 보유 중. 아무것도 하지 않음. */
    SKIPPED_LOCKED,

    /** Run이 존재하지 않음. */
    NOT_FOUND,

    /** 이미 종료 상태. 기록 없음. */
    ALREADY_TERMINAL,

    /** 백오프 대기 중. lastReconciledAt만 갱신. */
    DEFERRED,

    /** Provider 제출 성공, external handle 기록. */
    SUBMITTED,

    /** CANCELED로 확정. */
    CANCELED,

    /** Provider 보고에 따라 상태 전이. */
    STATE_CHANGED,

    /** 상태 변화 없이 task와 lastReconciledAt 갱신. */
    REFRESHED,

    /** 일시적 Provider 실패. 상태 유지, 백오프 설정. */
    TRANSIENT_FAILURE,

    /** SYSTEM_ERROR로 전이. */
    SYSTEM_ERROR,

    /** 패스 도중 다른 경로(cancel)가 상태를 변경해 기록을 포기함. */
    CONFLICT,

    /** Run Store 장애로 패스 중단. 상태 변경 없음. */
    ABORTED;

    /**
     * Run 레코드에 기록이 발생했는지 여부.
     *
     * @return 저장소에 변경이 커밋된 결과이면 true
     */
    public boolean isWritten() {
        return this != SKIPPED_LOCKED && this != NOT_FOUND && this != ALREADY_TERMINAL
            && this != CONFLICT && this != ABORTED;
    }
}
