package com.ryuqq.wes.application.lifecycle;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;

/**
 * Lifecycle Controller 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>maxProviderFailures: SYSTEM_ERROR로 승격하기 전 허용하는 연속 일시적 실패 횟수 (기본 5)</li>
 *   <li>defaultPageSize: 목록 조회 기본 페이지 크기 (기본 10)</li>
 *   <li>maxPageSize: 목록 조회 최대 페이지 크기 (기본 100)</li>
 *   <li>defaultProviderType: providerType이 없는 제출에 사용할 Provider (기본 없음)</li>
 *   <li>supportedWorkflowTypes: 허용 워크플로우 언어 (기본 CWL, WDL; 비어 있으면 제한 없음)</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param maxProviderFailures 연속 실패 한도 (1 이상)
 * @param defaultPageSize 기본 페이지 크기 (1 이상, maxPageSize 이하)
 * @param maxPageSize 최대 페이지 크기 (1 이상)
 * @param defaultProviderType 기본 Provider (nullable)
 * @param supportedWorkflowTypes 허용 워크플로우 언어 (대문자로 정규화)
 */
public record LifecycleConfig(
    int maxProviderFailures,
    int defaultPageSize,
    int maxPageSize,
    String defaultProviderType,
    Set<String> supportedWorkflowTypes
) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: maxProviderFailures=5, defaultPageSize=10, maxPageSize=100,
     * defaultProviderType=null, supportedWorkflowTypes=[CWL, WDL]</p>
     */
    public LifecycleConfig() {
        this(5, 10, 100, null, Set.of("CWL", "WDL"));
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public LifecycleConfig {
        if (maxProviderFailures <= 0) {
            throw new IllegalArgumentException(
                "maxProviderFailures must be positive (current: " + maxProviderFailures + ")"
            );
        }
        if (maxPageSize <= 0) {
            throw new IllegalArgumentException(
                "maxPageSize must be positive (current: " + maxPageSize + ")"
            );
        }
        if (defaultPageSize <= 0 || defaultPageSize > maxPageSize) {
            throw new IllegalArgumentException(
                "defaultPageSize must be between 1 and maxPageSize (current: " + defaultPageSize + ")"
            );
        }
        if (defaultProviderType != null && defaultProviderType.isBlank()) {
            throw new IllegalArgumentException("defaultProviderType cannot be blank");
        }
        if (supportedWorkflowTypes == null) {
            throw new IllegalArgumentException("supportedWorkflowTypes cannot be null");
        }
        Set<String> normalized = new LinkedHashSet<>();
        for (String type : supportedWorkflowTypes) {
            normalized.add(type.trim().toUpperCase(Locale.ROOT));
        }
        supportedWorkflowTypes = Collections.unmodifiableSet(normalized);
    }

    /**
     * 요청된 페이지 크기를 정책에 맞게 보정.
     *
     * @param requested 요청 크기 (null이면 기본값)
     * @return 실제 사용할 페이지 크기
     * @throws IllegalArgumentException 요청 크기가 양수가 아닌 경우
     */
    public int resolvePageSize(Integer requested) {
        if (requested == null) {
            return defaultPageSize;
        }
        if (requested <= 0) {
            throw new IllegalArgumentException("pageSize must be positive (current: " + requested + ")");
        }
        return Math.min(requested, maxPageSize);
    }

    /**
     * 워크플로우 언어 허용 여부.
     *
     * @param workflowType 정규화된 워크플로우 언어
     * @return 허용되면 true
     */
    public boolean supportsWorkflowType(String workflowType) {
        return supportedWorkflowTypes.isEmpty() || supportedWorkflowTypes.contains(workflowType);
    }

    /**
     * maxProviderFailures만 변경한 새 인스턴스 생성.
     */
    public LifecycleConfig withMaxProviderFailures(int maxProviderFailures) {
        return new LifecycleConfig(maxProviderFailures, defaultPageSize, maxPageSize, defaultProviderType, supportedWorkflowTypes);
    }

    /**
     * 페이지 크기 정책만 변경한 새 인스턴스 생성.
     */
    public LifecycleConfig withPageSizes(int defaultPageSize, int maxPageSize) {
        return new LifecycleConfig(maxProviderFailures, defaultPageSize, maxPageSize, defaultProviderType, supportedWorkflowTypes);
    }

    /**
     * defaultProviderType만 변경한 새 인스턴스 생성.
     */
    public LifecycleConfig withDefaultProviderType(String defaultProviderType) {
        return new LifecycleConfig(maxProviderFailures, defaultPageSize, maxPageSize, defaultProviderType, supportedWorkflowTypes);
    }

    /**
     * supportedWorkflowTypes만 변경한 새 인스턴스 생성.
     */
    public LifecycleConfig withSupportedWorkflowTypes(Set<String> supportedWorkflowTypes) {
        return new LifecycleConfig(maxProviderFailures, defaultPageSize, maxPageSize, defaultProviderType, supportedWorkflowTypes);
    }
}
