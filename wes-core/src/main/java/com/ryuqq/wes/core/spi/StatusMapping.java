package com.ryuqq.wes.core.spi;

import com.ryuqq.wes.core.statemachine.RunState;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Provider 고유 상태 어휘 → 정규 상태 매핑 테이블.
 *
 * <p>각 Adapter는 정적 테이블 하나를 가집니다. 조회는 대소문자를 구분하지 않으며,
 * 테이블에 없는 값은 {@link RunState#UNKNOWN}으로 매핑됩니다.</p>
 *
 * <pre>
 * private static final StatusMapping MAPPING = StatusMapping.builder()
 *     .map(RunState.RUNNING, "RUNNING")
 *     .map(RunState.COMPLETE, "COMPLETED")
 *     .build();
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class StatusMapping {

    private final Map<String, RunState> table;

    private StatusMapping(Map<String, RunState> table) {
        this.table = Collections.unmodifiableMap(new LinkedHashMap<>(table));
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Provider 상태를 정규 상태로 변환.
     *
     * @param nativeStatus Provider 고유 상태 (nullable)
     * @return 매핑된 상태, 없으면 UNKNOWN
     */
    public RunState map(String nativeStatus) {
        if (nativeStatus == null) {
            return RunState.UNKNOWN;
        }
        return table.getOrDefault(normalize(nativeStatus), RunState.UNKNOWN);
    }

    /**
     * 매핑 테이블 조회.
     *
     * @return 정규화된 Provider 상태 → 정규 상태 (읽기 전용)
     */
    public Map<String, RunState> asMap() {
        return table;
    }

    private static String normalize(String nativeStatus) {
        return nativeStatus.trim().toUpperCase(Locale.ROOT);
    }

    /**
     * StatusMapping 빌더.
     */
    public static final class Builder {

        private final Map<String, RunState> table = new LinkedHashMap<>();

        private Builder() {
        }

        /**
         * 하나 이상의 Provider 상태를 정규 상태로 매핑.
         *
         * @param state 정규 상태 (UNKNOWN 불가)
         * @param nativeStatuses Provider 상태 값
         * @return this
         */
        public Builder map(RunState state, String... nativeStatuses) {
            if (state == null || state == RunState.UNKNOWN) {
                throw new IllegalArgumentException("state cannot be null or UNKNOWN");
            }
            for (String nativeStatus : nativeStatuses) {
                RunState previous = table.put(normalize(nativeStatus), state);
                if (previous != null && previous != state) {
                    throw new IllegalArgumentException(
                        "Conflicting mapping for " + nativeStatus + ": " + previous + " / " + state
                    );
                }
            }
            return this;
        }

        public StatusMapping build() {
            return new StatusMapping(table);
        }
    }
}
