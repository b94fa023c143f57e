package com.ryuqq.wes.adapter.runner;

import com.ryuqq.wes.application.lifecycle.ReconcileOutcome;
import com.ryuqq.wes.application.lifecycle.Reconciler;
import com.ryuqq.wes.application.trigger.ReconcileQueue;
import com.ryuqq.wes.application.trigger.RunNotifier;
import com.ryuqq.wes.core.model.RunId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Set;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.Semaphore;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * 리컨실 요청 fan-in 큐와 워커 풀.
 *
 * <p>알림 수신부, 폴링 루프, 같은 프로세스의 submit/cancel이 모두 이 큐로 Run ID를 넣습니다.
 * 단일 dispatcher 스레드가 큐를 비우며 고정 크기 워커 풀에 {@link Reconciler#reconcile(RunId)}를
 * 넘깁니다.</p>
 *
 * <p><strong>동작 방식:</strong></p>
 * <pre>
 * enqueue(runId)
 *   → 이미 대기 중이면 합침 (중복 제거)
 *   → 큐가 가득 차면 WARN 후 버림 (폴링 루프가 다시 찾음)
 * dispatcher
 *   → permit 획득 (최대 concurrency개 동시 실행)
 *   → 워커에서 reconcile 실행, reconcileTimeoutMs 경과 시 인터럽트
 * </pre>
 *
 * <p>같은 Run이 두 워커에서 동시에 실행되더라도 Run 단위 잠금 때문에 하나는 SKIPPED_LOCKED로 끝납니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class ReconciliationScheduler implements ReconcileQueue, RunNotifier {

    private static final Logger log = LoggerFactory.getLogger(ReconciliationScheduler.class);
    private static final long DISPATCH_POLL_MS = 100;

    private final Reconciler reconciler;
    private final SchedulerConfig config;
    private final BlockingQueue<RunId> queue;
    private final Set<RunId> pending = ConcurrentHashMap.newKeySet();
    private final Semaphore permits;
    private final ExecutorService workers;
    private final ScheduledExecutorService watchdog;
    private final AtomicInteger completed = new AtomicInteger();
    private volatile boolean running;
    private boolean stopped;
    private Thread dispatcher;

    /**
     * 생성자.
     *
     * @param reconciler 리컨실 대상
     * @param config 설정
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public ReconciliationScheduler(Reconciler reconciler, SchedulerConfig config) {
        if (reconciler == null) {
            throw new IllegalArgumentException("reconciler cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.reconciler = reconciler;
        this.config = config;
        this.queue = new ArrayBlockingQueue<>(config.queueCapacity());
        this.permits = new Semaphore(config.concurrency());
        this.workers = Executors.newFixedThreadPool(config.concurrency(), new NamedThreadFactory("wes-reconcile-worker"));
        ScheduledThreadPoolExecutor timer = new ScheduledThreadPoolExecutor(1, new NamedThreadFactory("wes-reconcile-watchdog"));
        timer.setRemoveOnCancelPolicy(true);
        this.watchdog = timer;
    }

    /**
     * Run ID를 큐에 넣습니다.
     *
     * @param runId Run ID
     * @return 큐에 있거나 새로 들어갔으면 true, 큐가 가득 차 버려졌으면 false
     */
    @Override
    public boolean enqueue(RunId runId) {
        if (runId == null) {
            throw new IllegalArgumentException("runId cannot be null");
        }
        if (!pending.add(runId)) {
            log.debug("{} already pending", runId);
            return true;
        }
        if (!queue.offer(runId)) {
            pending.remove(runId);
            log.warn("Reconcile queue full ({}); dropped {}", config.queueCapacity(), runId);
            return false;
        }
        return true;
    }

    @Override
    public void announce(RunId runId) {
        enqueue(runId);
    }

    /**
     * dispatcher 스레드 시작.
     *
     * <p>워커 풀은 stop()에서 종료되므로 한 번 멈춘 스케줄러는 다시 시작할 수 없습니다.</p>
     *
     * @throws IllegalStateException stop() 이후 호출된 경우
     */
    public synchronized void start() {
        if (stopped) {
            throw new IllegalStateException("Reconciliation scheduler already stopped");
        }
        if (running) {
            return;
        }
        running = true;
        dispatcher = new Thread(this::dispatchLoop, "wes-reconcile-dispatcher");
        dispatcher.setDaemon(true);
        dispatcher.start();
        log.info("Reconciliation scheduler started (concurrency={}, queueCapacity={})",
            config.concurrency(), config.queueCapacity());
    }

    /**
     * 새 dispatch를 멈추고 진행 중인 패스를 shutdownTimeoutMs까지 기다립니다.
     *
     * <p>대기 중이던 Run ID는 버려집니다. 다음 기동 시 폴링 루프가 다시 찾습니다.</p>
     */
    public synchronized void stop() {
        if (!running) {
            return;
        }
        running = false;
        stopped = true;
        dispatcher.interrupt();
        try {
            dispatcher.join(config.shutdownTimeoutMs() + DISPATCH_POLL_MS);
            workers.shutdown();
            if (!workers.awaitTermination(config.shutdownTimeoutMs(), TimeUnit.MILLISECONDS)) {
                log.warn("Reconcile workers did not finish within {}ms; interrupting", config.shutdownTimeoutMs());
                workers.shutdownNow();
            }
        } catch (InterruptedException e) {
            workers.shutdownNow();
            Thread.currentThread().interrupt();
        } finally {
            watchdog.shutdownNow();
        }
        int dropped = queue.size();
        queue.clear();
        pending.clear();
        log.info("Reconciliation scheduler stopped ({} passes completed, {} pending dropped)",
            completed.get(), dropped);
    }

    /**
     * 아직 dispatch되지 않은 Run 수.
     *
     * @return 큐 크기
     */
    public int pendingCount() {
        return queue.size();
    }

    /**
     * 완료된 리컨실 패스 수 (타임아웃 포함).
     *
     * @return 완료 수
     */
    public int completedCount() {
        return completed.get();
    }

    public boolean isRunning() {
        return running;
    }

    private void dispatchLoop() {
        while (running) {
            try {
                permits.acquire();
                RunId runId = queue.poll(DISPATCH_POLL_MS, TimeUnit.MILLISECONDS);
                if (runId == null) {
                    permits.release();
                    continue;
                }
                // 꺼낸 뒤 대기 목록에서 제거: 패스 도중 도착한 알림은 다음 패스로 이어짐
                pending.remove(runId);
                dispatch(runId);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
        }
    }

    private void dispatch(RunId runId) {
        AtomicReference<ScheduledFuture<?>> timer = new AtomicReference<>();
        Future<?> task;
        try {
            // 워커 수와 permit 수가 같으므로 제출된 작업은 대기 없이 바로 시작됨
            task = workers.submit(() -> {
                try {
                    reconcileOne(runId);
                } finally {
                    ScheduledFuture<?> scheduled = timer.get();
                    if (scheduled != null) {
                        scheduled.cancel(false);
                    }
                    completed.incrementAndGet();
                    permits.release();
                }
            });
        } catch (RejectedExecutionException e) {
            permits.release();
            log.warn("Reconcile of {} rejected: scheduler is shutting down", runId);
            return;
        }
        try {
            timer.set(watchdog.schedule(() -> expire(runId, task), config.reconcileTimeoutMs(), TimeUnit.MILLISECONDS));
        } catch (RejectedExecutionException e) {
            log.debug("Watchdog not armed for {}: scheduler is shutting down", runId);
        }
    }

    private void reconcileOne(RunId runId) {
        try {
            ReconcileOutcome outcome = reconciler.reconcile(runId);
            log.debug("{} reconciled: {}", runId, outcome);
        } catch (RuntimeException e) {
            log.error("Unexpected failure while reconciling {}", runId, e);
        }
    }

    private void expire(RunId runId, Future<?> task) {
        if (!task.isDone()) {
            log.warn("Reconcile of {} exceeded {}ms; interrupting worker", runId, config.reconcileTimeoutMs());
            task.cancel(true);
        }
    }

    private static final class NamedThreadFactory implements ThreadFactory {

        private final String prefix;
        private final AtomicInteger counter = new AtomicInteger();

        NamedThreadFactory(String prefix) {
            this.prefix = prefix;
        }

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
