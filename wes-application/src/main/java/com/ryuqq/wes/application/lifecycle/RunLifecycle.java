package com.ryuqq.wes.application.lifecycle;

import com.ryuqq.wes.core.model.RunFilter;
import com.ryuqq.wes.core.model.RunId;
import com.ryuqq.wes.core.model.SubmissionSpec;
import com.ryuqq.wes.core.model.TaskLog;
import com.ryuqq.wes.core.model.WorkflowRun;
import com.ryuqq.wes.core.pagination.Page;
import com.ryuqq.wes.core.statemachine.RunState;

import java.util.Map;

/**
 * Workflow Run 제어 인터페이스 (요청 계층에 노출).
 *
 * <p>GA4GH WES 표면과 1:1로 대응하지만 전송 방식에는 독립적입니다.</p>
 *
 * <pre>
 * POST /runs                → submit
 * GET  /runs/{id}/status    → getStatus
 * GET  /runs/{id}           → getDetail
 * POST /runs/{id}/cancel    → cancel
 * GET  /runs                → list
 * GET  /runs/{id}/tasks     → listTasks
 * </pre>
 *
 * <p><strong>지연 분리:</strong> submit과 cancel은 Provider 응답을 기다리지 않고
 * 리컨실 이전 상태를 즉시 반환합니다. Provider 측 실패는 이후 조회로만 드러납니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface RunLifecycle {

    /**
     * Run을 QUEUED 상태로 생성하고 리컨실 채널에 알립니다.
     *
     * <p>Provider를 호출하지 않습니다.</p>
     *
     * @param spec 제출 파라미터
     * @return 새 Run ID
     * @throws com.ryuqq.wes.core.error.InvalidSubmissionException 잘못된 제출인 경우 (저장 안 됨)
     * @throws com.ryuqq.wes.core.error.UnknownProviderException 등록되지 않은 Provider인 경우
     */
    RunId submit(SubmissionSpec spec);

    /**
     * 현재 상태 조회 (저장소 읽기만 수행).
     *
     * @param runId Run ID
     * @return 현재 상태
     * @throws com.ryuqq.wes.core.error.RunNotFoundException Run이 없는 경우
     */
    RunState getStatus(RunId runId);

    /**
     * 전체 Run 레코드 조회.
     *
     * @param runId Run ID
     * @return Run 레코드
     * @throws com.ryuqq.wes.core.error.RunNotFoundException Run이 없는 경우
     */
    WorkflowRun getDetail(RunId runId);

    /**
     * Run 취소 요청.
     *
     * <p>QUEUED, INITIALIZING, RUNNING, PAUSED에서만 CANCELING으로 전이합니다.
     * 종료 상태 또는 이미 CANCELING인 Run은 현재 상태를 그대로 반환합니다.</p>
     *
     * @param runId Run ID
     * @return 요청 처리 후 상태
     * @throws com.ryuqq.wes.core.error.RunNotFoundException Run이 없는 경우
     */
    RunState cancel(RunId runId);

    /**
     * Run 목록 조회 (최신 순).
     *
     * @param filter 조회 조건
     * @param pageToken 이전 페이지 토큰 (첫 페이지는 null)
     * @param pageSize 페이지 크기 (null이면 기본값, 최대값으로 제한)
     * @return Run 페이지
     * @throws com.ryuqq.wes.core.error.InvalidPageTokenException 토큰이 유효하지 않은 경우
     */
    Page<WorkflowRun> list(RunFilter filter, String pageToken, Integer pageSize);

    /**
     * Run의 task 목록 조회.
     *
     * @param runId Run ID
     * @param pageToken 이전 페이지 토큰 (첫 페이지는 null)
     * @param pageSize 페이지 크기 (null이면 기본값, 최대값으로 제한)
     * @return task 페이지
     */
    Page<TaskLog> listTasks(RunId runId, String pageToken, Integer pageSize);

    /**
     * 사용 가능한 Provider 목록.
     *
     * @return provider type → 설명
     */
    Map<String, String> availableProviders();
}
