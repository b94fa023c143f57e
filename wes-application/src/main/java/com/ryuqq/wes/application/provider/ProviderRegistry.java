package com.ryuqq.wes.application.provider;

import com.ryuqq.wes.core.error.UnknownProviderException;
import com.ryuqq.wes.core.spi.ProviderAdapter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * provider type 문자열 → Provider Adapter 레지스트리.
 *
 * <p>등록된 모든 Adapter는 {@link Builder#build()} 시점에 생성 및 검증됩니다.
 * 설정 오류는 첫 사용 시점이 아닌 기동 시점에 드러납니다.</p>
 *
 * <p>resolve가 반환하는 Adapter는 {@link TimeLimitedProviderAdapter}로 감싸져
 * 모든 호출에 타임아웃이 적용됩니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * ProviderRegistry registry = ProviderRegistry.builder()
 *     .callTimeout(Duration.ofSeconds(30))
 *     .register("sevenbridges", "Seven Bridges Genomics platform", () -&gt; new SevenBridgesProviderAdapter(...))
 *     .register("arvados", "Arvados workflow platform", () -&gt; new ArvadosProviderAdapter(...))
 *     .build();
 *
 * ProviderAdapter adapter = registry.resolve("sevenbridges");
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class ProviderRegistry implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ProviderRegistry.class);

    private final Map<String, ProviderAdapter> adapters;
    private final Map<String, String> descriptions;
    private final ExecutorService callExecutor;

    private ProviderRegistry(Map<String, ProviderAdapter> adapters, Map<String, String> descriptions,
                             ExecutorService callExecutor) {
        this.adapters = Collections.unmodifiableMap(adapters);
        this.descriptions = Collections.unmodifiableMap(new TreeMap<>(descriptions));
        this.callExecutor = callExecutor;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * provider type에 해당하는 Adapter 조회.
     *
     * @param providerType provider type
     * @return 타임아웃이 적용된 Adapter
     * @throws UnknownProviderException 등록되지 않은 경우
     */
    public ProviderAdapter resolve(String providerType) {
        ProviderAdapter adapter = providerType == null ? null : adapters.get(providerType);
        if (adapter == null) {
            throw new UnknownProviderException(providerType);
        }
        return adapter;
    }

    /**
     * 등록 여부 확인.
     *
     * @param providerType provider type
     * @return 등록되어 있으면 true
     */
    public boolean contains(String providerType) {
        return providerType != null && adapters.containsKey(providerType);
    }

    /**
     * 등록된 Provider 목록.
     *
     * @return provider type → 설명 (이름순)
     */
    public Map<String, String> available() {
        return descriptions;
    }

    /**
     * Provider 호출 executor 종료.
     */
    @Override
    public void close() {
        callExecutor.shutdownNow();
        try {
            if (!callExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("Provider call executor did not terminate within 5s");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    /**
     * ProviderRegistry 빌더.
     */
    public static final class Builder {

        private final Map<String, Registration> registrations = new LinkedHashMap<>();
        private Duration callTimeout = Duration.ofSeconds(30);

        private Builder() {
        }

        /**
         * Adapter 등록.
         *
         * @param providerType provider type (Adapter의 providerType()과 같아야 함)
         * @param description 사람이 읽을 수 있는 설명
         * @param factory Adapter 생성자
         * @return this
         * @throws IllegalArgumentException 파라미터가 잘못되었거나 중복 등록인 경우
         */
        public Builder register(String providerType, String description,
                                Supplier<? extends ProviderAdapter> factory) {
            if (providerType == null || providerType.isBlank()) {
                throw new IllegalArgumentException("providerType cannot be null or blank");
            }
            if (factory == null) {
                throw new IllegalArgumentException("factory cannot be null");
            }
            if (registrations.containsKey(providerType)) {
                throw new IllegalArgumentException("Provider already registered: " + providerType);
            }
            registrations.put(providerType, new Registration(description == null ? providerType : description, factory));
            return this;
        }

        /**
         * Provider 호출당 타임아웃.
         *
         * @param callTimeout 타임아웃 (양수, 기본 30초)
         * @return this
         */
        public Builder callTimeout(Duration callTimeout) {
            if (callTimeout == null || callTimeout.isZero() || callTimeout.isNegative()) {
                throw new IllegalArgumentException("callTimeout must be positive (current: " + callTimeout + ")");
            }
            this.callTimeout = callTimeout;
            return this;
        }

        /**
         * 모든 Adapter를 생성하고 검증합니다.
         *
         * @return ProviderRegistry
         * @throws IllegalStateException Adapter 생성 실패 또는 providerType 불일치 시
         */
        public ProviderRegistry build() {
            Map<String, ProviderAdapter> raw = new LinkedHashMap<>();
            Map<String, String> descriptions = new LinkedHashMap<>();
            for (Map.Entry<String, Registration> entry : registrations.entrySet()) {
                String key = entry.getKey();
                raw.put(key, instantiate(key, entry.getValue().factory()));
                descriptions.put(key, entry.getValue().description());
            }
            if (raw.isEmpty()) {
                log.warn("Provider registry built without any provider; every submission will be rejected");
            }

            ExecutorService callExecutor = Executors.newCachedThreadPool(new CallThreadFactory());
            Map<String, ProviderAdapter> adapters = new LinkedHashMap<>();
            raw.forEach((key, adapter) ->
                adapters.put(key, new TimeLimitedProviderAdapter(adapter, callExecutor, callTimeout)));
            return new ProviderRegistry(adapters, descriptions, callExecutor);
        }

        private static ProviderAdapter instantiate(String key, Supplier<? extends ProviderAdapter> factory) {
            ProviderAdapter adapter;
            try {
                adapter = factory.get();
            } catch (RuntimeException e) {
                throw new IllegalStateException("Failed to initialize provider: " + key, e);
            }
            if (adapter == null) {
                throw new IllegalStateException("Provider factory returned null: " + key);
            }
            if (!key.equals(adapter.providerType())) {
                throw new IllegalStateException(String.format(
                    "Provider registered as %s reports providerType %s", key, adapter.providerType()
                ));
            }
            if (adapter.statusMapping() == null) {
                throw new IllegalStateException("Provider has no status mapping: " + key);
            }
            log.info("Registered provider {} ({})", key, adapter.getClass().getSimpleName());
            return adapter;
        }
    }

    private record Registration(String description, Supplier<? extends ProviderAdapter> factory) {
    }

    private static final class CallThreadFactory implements ThreadFactory {

        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, "wes-provider-call-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
