package com.ryuqq.wes.daemon;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CountDownLatch;

/**
 * 리컨실 데몬 진입점.
 *
 * <p>환경 변수로 설정을 읽어 엔진을 시작하고, 종료 시그널(SIGTERM/SIGINT)까지 대기합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class WesDaemon {

    private static final Logger log = LoggerFactory.getLogger(WesDaemon.class);

    private WesDaemon() {
    }

    public static void main(String[] args) throws InterruptedException {
        EngineSettings settings;
        WesEngine engine;
        try {
            settings = EngineSettings.fromEnv(System::getenv);
            engine = WesEngine.create(settings);
        } catch (IllegalArgumentException | IllegalStateException e) {
            log.error("Invalid daemon configuration", e);
            System.exit(2);
            return;
        }
        log.info("Starting WES daemon with {}", settings);

        CountDownLatch shutdown = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutdown signal received");
            engine.close();
            shutdown.countDown();
        }, "wes-shutdown"));

        engine.start();
        shutdown.await();
    }
}
