package com.ryuqq.wes.daemon;

import com.ryuqq.wes.adapter.provider.SevenBridgesConfig;
import com.ryuqq.wes.application.provider.ProviderRegistry;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * EngineSettings 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class EngineSettingsTest {

    @Test
    void 변수가_없으면_기본값() {
        // when
        EngineSettings settings = EngineSettings.fromEnv(Map.<String, String>of()::get);

        // then
        assertThat(settings.pollerConfig().scanIntervalMs()).isEqualTo(300_000);
        assertThat(settings.pollerConfig().staleThresholdMs()).isEqualTo(300_000);
        assertThat(settings.pollerConfig().maxActiveRuns()).isEqualTo(10);
        assertThat(settings.schedulerConfig().concurrency()).isEqualTo(10);
        assertThat(settings.providerCallTimeout()).isEqualTo(Duration.ofSeconds(30));
        assertThat(settings.notificationConfig().endpoint().toString()).isEqualTo("http://localhost:5001/notify");
        assertThat(settings.lifecycleConfig().defaultProviderType()).isNull();
        assertThat(settings.sevenBridgesConfig()).isEmpty();
        assertThat(settings.arvadosConfig()).isEmpty();
    }

    @Test
    void 환경_변수를_모듈_설정으로_변환한다() {
        // given
        Map<String, String> env = Map.of(
            "DAEMON_POLL_INTERVAL", "60",
            "DAEMON_STATUS_CHECK_INTERVAL", "120",
            "DAEMON_MAX_CONCURRENT_WORKFLOWS", "4",
            "DAEMON_WORKER_THREADS", "2",
            "DAEMON_PROVIDER_TIMEOUT", "90",
            "DAEMON_NOTIFICATION_HOST", "0.0.0.0",
            "DAEMON_NOTIFICATION_PORT", "6001",
            "WES_DEFAULT_PROVIDER", "arvados"
        );

        // when
        EngineSettings settings = EngineSettings.fromEnv(env::get);

        // then
        assertThat(settings.pollerConfig().scanIntervalMs()).isEqualTo(60_000);
        assertThat(settings.pollerConfig().staleThresholdMs()).isEqualTo(120_000);
        assertThat(settings.pollerConfig().maxActiveRuns()).isEqualTo(4);
        assertThat(settings.schedulerConfig().concurrency()).isEqualTo(2);
        assertThat(settings.schedulerConfig().reconcileTimeoutMs()).isEqualTo(270_000);
        assertThat(settings.notificationConfig().host()).isEqualTo("0.0.0.0");
        assertThat(settings.notificationConfig().port()).isEqualTo(6001);
        assertThat(settings.lifecycleConfig().defaultProviderType()).isEqualTo("arvados");
    }

    @Test
    void 정수가_아닌_값은_변수_이름과_함께_거부한다() {
        // given
        Map<String, String> env = Map.of("DAEMON_POLL_INTERVAL", "five");

        // when & then
        assertThatThrownBy(() -> EngineSettings.fromEnv(env::get))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("DAEMON_POLL_INTERVAL")
            .hasMessageContaining("five");
    }

    @Test
    void SevenBridges_토큰이_있으면_프로젝트도_필요하다() {
        // given
        Map<String, String> env = Map.of("SEVENBRIDGES_API_TOKEN", "token");

        // when & then
        assertThatThrownBy(() -> EngineSettings.fromEnv(env::get))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("SEVENBRIDGES_PROJECT");
    }

    @Test
    void SevenBridges_엔드포인트_기본값() {
        // given
        Map<String, String> env = Map.of("SEVENBRIDGES_API_TOKEN", "token", "SEVENBRIDGES_PROJECT", "alice/demo");

        // when
        EngineSettings settings = EngineSettings.fromEnv(env::get);

        // then
        assertThat(settings.sevenBridgesConfig()).isPresent();
        assertThat(settings.sevenBridgesConfig().get().apiEndpoint()).isEqualTo(SevenBridgesConfig.DEFAULT_ENDPOINT);
        assertThat(settings.toString()).doesNotContain("token");
    }

    @Test
    void Arvados는_세_변수가_모두_필요하다() {
        // given
        Map<String, String> env = Map.of("ARVADOS_API_HOST", "zzzzz.arvadosapi.com", "ARVADOS_API_TOKEN", "t");

        // when & then
        assertThatThrownBy(() -> EngineSettings.fromEnv(env::get))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("ARVADOS_PROJECT_UUID");
    }

    @Test
    void 자격_증명이_있는_Provider만_등록한다() {
        // given
        Map<String, String> env = Map.of(
            "ARVADOS_API_HOST", "zzzzz.arvadosapi.com",
            "ARVADOS_API_TOKEN", "t",
            "ARVADOS_PROJECT_UUID", "zzzzz-j7d0g-project000000001"
        );
        EngineSettings settings = EngineSettings.fromEnv(env::get);

        // when
        try (ProviderRegistry registry = WesEngine.providerRegistry(settings)) {
            // then
            assertThat(registry.available()).containsOnlyKeys("arvados");
            assertThat(registry.contains("sevenbridges")).isFalse();
        }
    }
}
