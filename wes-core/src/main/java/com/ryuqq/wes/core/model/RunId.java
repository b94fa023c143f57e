package com.ryuqq.wes.core.model;

import java.util.UUID;

/**
 * Workflow Run의 전역 고유 식별자.
 *
 * <p>제출 시점에 할당되며 이후 변경되지 않습니다.
 * 알림 채널과 저장소에서 Run을 식별하는 유일한 키입니다.</p>
 *
 * <p><strong>유효성 검증:</strong></p>
 * <ul>
 *   <li>null 또는 빈 문자열 불가</li>
 *   <li>길이: 1~255자</li>
 *   <li>패턴: 영숫자, 하이픈(-), 언더스코어(_)만 허용</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class RunId {

    private final String value;

    private RunId(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("RunId cannot be null or blank");
        }
        if (value.length() > 255) {
            throw new IllegalArgumentException("RunId length cannot exceed 255 characters");
        }
        if (!value.matches("^[a-zA-Z0-9\\-_]+$")) {
            throw new IllegalArgumentException("RunId contains invalid characters. Only alphanumeric, hyphen, and underscore are allowed");
        }
        this.value = value;
    }

    /**
     * RunId 생성.
     *
     * @param value RunId 값
     * @return RunId 인스턴스
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public static RunId of(String value) {
        return new RunId(value);
    }

    /**
     * 새 UUID 기반 RunId 발급.
     *
     * @return 새 RunId
     */
    public static RunId generate() {
        return new RunId(UUID.randomUUID().toString());
    }

    /**
     * RunId 값 조회.
     *
     * @return RunId 값
     */
    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        RunId runId = (RunId) o;
        return value.equals(runId.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return "RunId{" + value + '}';
    }
}
