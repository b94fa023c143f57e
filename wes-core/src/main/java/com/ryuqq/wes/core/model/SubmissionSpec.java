package com.ryuqq.wes.core.model;

import com.ryuqq.wes.core.error.InvalidSubmissionException;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 호출자가 제출한 워크플로우 실행 파라미터.
 *
 * <p>엔진에게는 불투명한 값이며 Provider Adapter로 그대로 전달됩니다.
 * 엔진이 해석하는 필드는 providerType뿐입니다.</p>
 *
 * <p><strong>필수 필드:</strong> workflowUrl, workflowType, workflowTypeVersion.
 * 누락 시 {@link InvalidSubmissionException}이 발생하며 Run은 생성되지 않습니다.</p>
 *
 * <p>workflowType은 대문자로 정규화됩니다 (예: "cwl" → "CWL").</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param workflowUrl 워크플로우 정의 위치
 * @param workflowType 워크플로우 언어 (CWL, WDL 등)
 * @param workflowTypeVersion 워크플로우 언어 버전
 * @param workflowParams 워크플로우 입력 파라미터
 * @param workflowEngine 엔진 이름 (nullable)
 * @param workflowEngineVersion 엔진 버전 (nullable)
 * @param workflowEngineParameters 엔진 파라미터
 * @param tags 태그
 * @param providerType 실행 Provider (nullable, 없으면 기본 Provider)
 * @param userId 제출 사용자 (nullable)
 */
public record SubmissionSpec(
    String workflowUrl,
    String workflowType,
    String workflowTypeVersion,
    Map<String, Object> workflowParams,
    String workflowEngine,
    String workflowEngineVersion,
    Map<String, String> workflowEngineParameters,
    Map<String, String> tags,
    String providerType,
    String userId
) {

    /**
     * Compact constructor (유효성 검증 및 방어적 복사).
     *
     * @throws InvalidSubmissionException 필수 필드가 누락된 경우
     */
    public SubmissionSpec {
        if (workflowUrl == null || workflowUrl.isBlank()) {
            throw new InvalidSubmissionException("workflowUrl cannot be null or blank");
        }
        if (workflowType == null || workflowType.isBlank()) {
            throw new InvalidSubmissionException("workflowType cannot be null or blank");
        }
        if (workflowTypeVersion == null || workflowTypeVersion.isBlank()) {
            throw new InvalidSubmissionException("workflowTypeVersion cannot be null or blank");
        }
        if (providerType != null && providerType.isBlank()) {
            throw new InvalidSubmissionException("providerType cannot be blank");
        }
        workflowType = workflowType.trim().toUpperCase();
        workflowParams = copy(workflowParams);
        workflowEngineParameters = copy(workflowEngineParameters);
        tags = copy(tags);
    }

    /**
     * 필수 필드만으로 생성.
     *
     * @param workflowUrl 워크플로우 정의 위치
     * @param workflowType 워크플로우 언어
     * @param workflowTypeVersion 워크플로우 언어 버전
     * @return SubmissionSpec
     */
    public static SubmissionSpec of(String workflowUrl, String workflowType, String workflowTypeVersion) {
        return new SubmissionSpec(workflowUrl, workflowType, workflowTypeVersion,
            null, null, null, null, null, null, null);
    }

    /**
     * workflowParams만 변경한 새 인스턴스 생성.
     */
    public SubmissionSpec withWorkflowParams(Map<String, Object> workflowParams) {
        return new SubmissionSpec(workflowUrl, workflowType, workflowTypeVersion, workflowParams,
            workflowEngine, workflowEngineVersion, workflowEngineParameters, tags, providerType, userId);
    }

    /**
     * workflowEngineParameters만 변경한 새 인스턴스 생성.
     */
    public SubmissionSpec withWorkflowEngineParameters(Map<String, String> workflowEngineParameters) {
        return new SubmissionSpec(workflowUrl, workflowType, workflowTypeVersion, workflowParams,
            workflowEngine, workflowEngineVersion, workflowEngineParameters, tags, providerType, userId);
    }

    /**
     * tags만 변경한 새 인스턴스 생성.
     */
    public SubmissionSpec withTags(Map<String, String> tags) {
        return new SubmissionSpec(workflowUrl, workflowType, workflowTypeVersion, workflowParams,
            workflowEngine, workflowEngineVersion, workflowEngineParameters, tags, providerType, userId);
    }

    /**
     * providerType만 변경한 새 인스턴스 생성.
     */
    public SubmissionSpec withProviderType(String providerType) {
        return new SubmissionSpec(workflowUrl, workflowType, workflowTypeVersion, workflowParams,
            workflowEngine, workflowEngineVersion, workflowEngineParameters, tags, providerType, userId);
    }

    /**
     * userId만 변경한 새 인스턴스 생성.
     */
    public SubmissionSpec withUserId(String userId) {
        return new SubmissionSpec(workflowUrl, workflowType, workflowTypeVersion, workflowParams,
            workflowEngine, workflowEngineVersion, workflowEngineParameters, tags, providerType, userId);
    }

    /**
     * 사람이 읽을 수 있는 실행 이름.
     *
     * <p>tags의 "Name", 엔진 파라미터의 "name" 순으로 찾고, 없으면 null.</p>
     *
     * @return 실행 이름 또는 null
     */
    public String displayName() {
        String name = tags.get("Name");
        if (name != null && !name.isBlank()) {
            return name;
        }
        return workflowEngineParameters.get("name");
    }

    private static <V> Map<String, V> copy(Map<String, V> source) {
        if (source == null || source.isEmpty()) {
            return Collections.emptyMap();
        }
        return Collections.unmodifiableMap(new LinkedHashMap<>(source));
    }
}
