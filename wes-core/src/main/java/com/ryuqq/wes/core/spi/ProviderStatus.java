package com.ryuqq.wes.core.spi;

import com.ryuqq.wes.core.model.TaskLog;
import com.ryuqq.wes.core.statemachine.RunState;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Provider가 보고한 Run 상태 스냅샷.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param state 정규 상태로 매핑된 값 (매핑 불가 시 UNKNOWN)
 * @param nativeStatus Provider 고유 상태 문자열
 * @param outputs 실행 결과 (완료 시에만 의미 있음)
 * @param tasks task 목록
 * @param message Provider가 제공한 오류 또는 상태 메시지 (nullable)
 */
public record ProviderStatus(
    RunState state,
    String nativeStatus,
    Map<String, Object> outputs,
    List<TaskLog> tasks,
    String message
) {

    public ProviderStatus {
        if (state == null) {
            throw new IllegalArgumentException("state cannot be null");
        }
        outputs = outputs == null || outputs.isEmpty()
            ? Collections.emptyMap()
            : Collections.unmodifiableMap(new LinkedHashMap<>(outputs));
        tasks = tasks == null ? List.of() : List.copyOf(tasks);
    }

    /**
     * 상태만 있는 스냅샷.
     *
     * @param state 정규 상태
     * @param nativeStatus Provider 고유 상태
     * @return ProviderStatus
     */
    public static ProviderStatus of(RunState state, String nativeStatus) {
        return new ProviderStatus(state, nativeStatus, null, null, null);
    }
}
