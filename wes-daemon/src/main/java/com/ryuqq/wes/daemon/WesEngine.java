package com.ryuqq.wes.daemon;

import com.ryuqq.wes.adapter.inmemory.store.InMemoryRunStore;
import com.ryuqq.wes.adapter.notification.NotificationServer;
import com.ryuqq.wes.adapter.provider.ArvadosProviderAdapter;
import com.ryuqq.wes.adapter.provider.SevenBridgesProviderAdapter;
import com.ryuqq.wes.adapter.runner.ReconciliationScheduler;
import com.ryuqq.wes.adapter.runner.StaleRunPoller;
import com.ryuqq.wes.application.lifecycle.LifecycleController;
import com.ryuqq.wes.application.lifecycle.RunLifecycle;
import com.ryuqq.wes.application.provider.ProviderRegistry;
import com.ryuqq.wes.core.model.RunId;
import com.ryuqq.wes.core.spi.RunStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 엔진 조립 루트.
 *
 * <p>Store, Provider 레지스트리, 상태 머신, 스케줄러, 폴러, 알림 서버를 연결합니다.</p>
 *
 * <pre>
 * submit/cancel ─announce→ ReconciliationScheduler ←enqueue─ NotificationServer (외부 알림)
 *                                   ↑        └─reconcile→ LifecycleController → ProviderAdapter
 *                           StaleRunPoller (주기 스캔)
 * </pre>
 *
 * <p><strong>시작/종료 순서:</strong> scheduler → 알림 서버 → poller 순으로 시작하고, 역순으로 종료합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class WesEngine implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(WesEngine.class);

    private final ProviderRegistry providers;
    private final LifecycleController controller;
    private final ReconciliationScheduler scheduler;
    private final StaleRunPoller poller;
    private final NotificationServer notificationServer;
    private boolean started;
    private boolean closed;

    /**
     * 생성자.
     *
     * @param settings 설정
     * @param store Run 저장소
     * @param providers Provider 레지스트리 (엔진 종료 시 함께 닫힘)
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public WesEngine(EngineSettings settings, RunStore store, ProviderRegistry providers) {
        if (settings == null) {
            throw new IllegalArgumentException("settings cannot be null");
        }
        if (store == null) {
            throw new IllegalArgumentException("store cannot be null");
        }
        if (providers == null) {
            throw new IllegalArgumentException("providers cannot be null");
        }
        if (settings.defaultProvider() != null && !providers.contains(settings.defaultProvider())) {
            log.warn("Default provider {} is not registered (available: {})",
                settings.defaultProvider(), providers.available().keySet());
        }

        this.providers = providers;
        this.controller = new LifecycleController(store, providers, this::announce, settings.lifecycleConfig());
        this.scheduler = new ReconciliationScheduler(controller, settings.schedulerConfig());
        this.poller = new StaleRunPoller(store, scheduler, settings.pollerConfig());
        this.notificationServer = new NotificationServer(settings.notificationConfig(), scheduler);
    }

    /**
     * 환경 설정으로 엔진을 만듭니다.
     *
     * <p>자격 증명이 있는 Provider만 등록하고, 저장소는 in-memory 구현을 사용합니다.</p>
     *
     * @param settings 설정
     * @return 시작 전 엔진
     * @throws IllegalStateException Provider 초기화 실패 시
     */
    public static WesEngine create(EngineSettings settings) {
        return new WesEngine(settings, new InMemoryRunStore(), providerRegistry(settings));
    }

    static ProviderRegistry providerRegistry(EngineSettings settings) {
        ProviderRegistry.Builder builder = ProviderRegistry.builder().callTimeout(settings.providerCallTimeout());
        settings.sevenBridgesConfig().ifPresent(config -> builder.register(
            SevenBridgesProviderAdapter.TYPE,
            "Seven Bridges platform (" + config.apiEndpoint() + ")",
            () -> new SevenBridgesProviderAdapter(config)
        ));
        settings.arvadosConfig().ifPresent(config -> builder.register(
            ArvadosProviderAdapter.TYPE,
            "Arvados (" + config.apiHost() + ")",
            () -> new ArvadosProviderAdapter(config)
        ));
        return builder.build();
    }

    /**
     * 엔진 시작.
     *
     * @throws IllegalStateException 알림 서버 바인드 실패 또는 종료된 엔진인 경우
     */
    public synchronized void start() {
        if (closed) {
            throw new IllegalStateException("Engine already closed");
        }
        if (started) {
            return;
        }
        scheduler.start();
        try {
            notificationServer.start();
        } catch (IllegalStateException e) {
            scheduler.stop();
            throw e;
        }
        poller.start();
        started = true;
        log.info("WES engine started with providers {}", providers.available().keySet());
    }

    /**
     * 제어 인터페이스.
     *
     * @return RunLifecycle
     */
    public RunLifecycle lifecycle() {
        return controller;
    }

    /**
     * 알림 서버가 바인드된 포트.
     *
     * @return 포트
     */
    public int notificationPort() {
        return notificationServer.port();
    }

    /**
     * 엔진 종료 (poller → 알림 서버 → scheduler → Provider 순).
     */
    @Override
    public synchronized void close() {
        if (closed) {
            return;
        }
        closed = true;
        poller.stop();
        notificationServer.stop();
        scheduler.stop();
        providers.close();
        log.info("WES engine stopped");
    }

    private void announce(RunId runId) {
        scheduler.announce(runId);
    }
}
