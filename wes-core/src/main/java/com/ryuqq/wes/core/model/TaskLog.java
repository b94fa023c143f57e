package com.ryuqq.wes.core.model;

import java.time.Instant;
import java.util.List;

/**
 * Provider가 보고한 Run의 하위 실행 단위.
 *
 * <p>Run이 전적으로 소유하며, 상태 갱신 때마다 목록 전체가 교체됩니다.
 * 부분 수정은 없습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param id Provider 측 task 식별자
 * @param name task 이름
 * @param cmd 실행 명령 (없으면 빈 목록)
 * @param startTime 시작 시각 (nullable)
 * @param endTime 종료 시각 (nullable)
 * @param exitCode 종료 코드 (nullable)
 * @param stdoutUrl 표준 출력 로그 위치 (nullable)
 * @param stderrUrl 표준 에러 로그 위치 (nullable)
 * @param nativeStatus Provider 고유 상태 문자열 (nullable)
 */
public record TaskLog(
    String id,
    String name,
    List<String> cmd,
    Instant startTime,
    Instant endTime,
    Integer exitCode,
    String stdoutUrl,
    String stderrUrl,
    String nativeStatus
) {

    public TaskLog {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("id cannot be null or blank");
        }
        if (name == null) {
            name = id;
        }
        cmd = cmd == null ? List.of() : List.copyOf(cmd);
    }
}
