package com.ryuqq.wes.adapter.runner;

import com.ryuqq.wes.application.trigger.ReconcileQueue;
import com.ryuqq.wes.core.model.RunId;
import com.ryuqq.wes.core.model.WorkflowRun;
import com.ryuqq.wes.core.spi.RunStore;
import com.ryuqq.wes.core.statemachine.RunState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * 폴링 루프 컴포넌트.
 *
 * <p>알림은 유실될 수 있으므로 이 루프가 진행의 최종 보증입니다.
 * 주기적으로 Run Store를 스캔해 리컨실이 필요한 Run을 {@link ReconcileQueue}에 넣습니다.</p>
 *
 * <p><strong>스캔 순서:</strong></p>
 * <pre>
 * 1. 빈 슬롯 = maxActiveRuns - countActive()
 * 2. scanQueued(min(빈 슬롯, batchSize))           → 제출 대상
 * 3. scanStale(now - staleThreshold, batchSize)   → 상태 갱신 대상
 *    (QUEUED는 1~2단계의 슬롯 제한을 따르므로 제외)
 * </pre>
 *
 * <p>스캔 중 발생한 예외는 로그만 남기고 다음 주기에 다시 시도합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class StaleRunPoller {

    private static final Logger log = LoggerFactory.getLogger(StaleRunPoller.class);

    private final RunStore store;
    private final ReconcileQueue queue;
    private final PollerConfig config;
    private final Clock clock;
    private ScheduledExecutorService timer;

    /**
     * UTC 시스템 시계를 사용하는 생성자.
     *
     * @param store Run 저장소
     * @param queue 리컨실 큐
     * @param config 설정
     */
    public StaleRunPoller(RunStore store, ReconcileQueue queue, PollerConfig config) {
        this(store, queue, config, Clock.systemUTC());
    }

    /**
     * 생성자.
     *
     * @param store Run 저장소
     * @param queue 리컨실 큐
     * @param config 설정
     * @param clock 시계
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public StaleRunPoller(RunStore store, ReconcileQueue queue, PollerConfig config, Clock clock) {
        if (store == null) {
            throw new IllegalArgumentException("store cannot be null");
        }
        if (queue == null) {
            throw new IllegalArgumentException("queue cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.store = store;
        this.queue = queue;
        this.config = config;
        this.clock = clock;
    }

    /**
     * 한 번의 스캔.
     *
     * @return 큐에 넣은 Run 수
     */
    public int scan() {
        Set<RunId> enqueued = new LinkedHashSet<>();

        // 1. 슬롯이 남은 만큼 QUEUED Run 제출
        int freeSlots = config.maxActiveRuns() - store.countActive();
        int admitted = 0;
        if (freeSlots > 0) {
            for (RunId runId : store.scanQueued(Math.min(freeSlots, config.batchSize()))) {
                if (queue.enqueue(runId)) {
                    enqueued.add(runId);
                    admitted++;
                }
            }
        } else {
            log.debug("No free slots ({} active runs); QUEUED runs wait", config.maxActiveRuns());
        }

        // 2. 오래 갱신되지 않은 비종료 Run 상태 갱신
        Instant threshold = clock.instant().minusMillis(config.staleThresholdMs());
        List<RunId> stale = store.scanStale(threshold, config.batchSize());
        int refreshed = 0;
        for (RunId runId : stale) {
            if (enqueued.contains(runId) || isQueued(runId)) {
                continue;
            }
            if (queue.enqueue(runId)) {
                enqueued.add(runId);
                refreshed++;
            }
        }

        log.info("Poll scan completed: {} enqueued ({} submissions, {} stale refreshes)",
            enqueued.size(), admitted, refreshed);
        return enqueued.size();
    }

    /**
     * scanIntervalMs 간격의 고정 지연 루프 시작 (첫 스캔은 즉시).
     */
    public synchronized void start() {
        if (timer != null) {
            return;
        }
        timer = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "wes-poller");
            thread.setDaemon(true);
            return thread;
        });
        timer.scheduleWithFixedDelay(this::safeScan, 0, config.scanIntervalMs(), TimeUnit.MILLISECONDS);
        log.info("Stale run poller started (interval={}ms, staleThreshold={}ms, maxActiveRuns={})",
            config.scanIntervalMs(), config.staleThresholdMs(), config.maxActiveRuns());
    }

    /**
     * 폴링 루프 정지.
     */
    public synchronized void stop() {
        if (timer == null) {
            return;
        }
        timer.shutdownNow();
        try {
            if (!timer.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("Poller did not terminate within 5s");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        timer = null;
        log.info("Stale run poller stopped");
    }

    private void safeScan() {
        try {
            scan();
        } catch (RuntimeException e) {
            // 예외가 빠져나가면 이후 스케줄이 중단됨
            log.error("Poll scan failed; retrying in {}ms", config.scanIntervalMs(), e);
        }
    }

    private boolean isQueued(RunId runId) {
        Optional<WorkflowRun> run = store.find(runId);
        return run.isPresent() && run.get().state() == RunState.QUEUED;
    }
}
