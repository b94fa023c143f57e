package com.ryuqq.wes.core.model;

import com.ryuqq.wes.core.statemachine.RunState;

import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Run 목록 조회 조건.
 *
 * <p>모든 조건은 AND로 결합됩니다. 비어 있는 조건은 무시됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param states 허용 상태 집합 (비어 있으면 전체)
 * @param providerType provider type (nullable)
 * @param userId 사용자 (nullable)
 * @param tags 모두 일치해야 하는 태그
 */
public record RunFilter(
    Set<RunState> states,
    String providerType,
    String userId,
    Map<String, String> tags
) {

    public RunFilter {
        states = states == null || states.isEmpty()
            ? Collections.emptySet()
            : Collections.unmodifiableSet(EnumSet.copyOf(states));
        tags = tags == null || tags.isEmpty()
            ? Collections.emptyMap()
            : Collections.unmodifiableMap(new LinkedHashMap<>(tags));
    }

    /**
     * 조건 없는 필터.
     *
     * @return 모든 Run과 일치하는 필터
     */
    public static RunFilter all() {
        return new RunFilter(null, null, null, null);
    }

    public RunFilter withStates(Set<RunState> states) {
        return new RunFilter(states, providerType, userId, tags);
    }

    public RunFilter withProviderType(String providerType) {
        return new RunFilter(states, providerType, userId, tags);
    }

    public RunFilter withUserId(String userId) {
        return new RunFilter(states, providerType, userId, tags);
    }

    public RunFilter withTags(Map<String, String> tags) {
        return new RunFilter(states, providerType, userId, tags);
    }

    /**
     * Run이 조건과 일치하는지 확인.
     *
     * @param run 대상 Run
     * @return 모든 조건을 만족하면 true
     */
    public boolean matches(WorkflowRun run) {
        if (!states.isEmpty() && !states.contains(run.state())) {
            return false;
        }
        if (providerType != null && !providerType.equals(run.providerType())) {
            return false;
        }
        if (userId != null && !userId.equals(run.spec().userId())) {
            return false;
        }
        for (Map.Entry<String, String> tag : tags.entrySet()) {
            if (!Objects.equals(tag.getValue(), run.spec().tags().get(tag.getKey()))) {
                return false;
            }
        }
        return true;
    }
}
