package com.ryuqq.wes.application.lifecycle;

import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * LifecycleConfig 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class LifecycleConfigTest {

    @Test
    void 기본값() {
        LifecycleConfig config = new LifecycleConfig();

        assertThat(config.maxProviderFailures()).isEqualTo(5);
        assertThat(config.defaultPageSize()).isEqualTo(10);
        assertThat(config.maxPageSize()).isEqualTo(100);
        assertThat(config.defaultProviderType()).isNull();
        assertThat(config.supportedWorkflowTypes()).containsExactlyInAnyOrder("CWL", "WDL");
    }

    @Test
    void resolvePageSize_null이면_기본값_초과하면_상한() {
        LifecycleConfig config = new LifecycleConfig();

        assertThat(config.resolvePageSize(null)).isEqualTo(10);
        assertThat(config.resolvePageSize(25)).isEqualTo(25);
        assertThat(config.resolvePageSize(500)).isEqualTo(100);
    }

    @Test
    void resolvePageSize_양수가_아니면_거부() {
        LifecycleConfig config = new LifecycleConfig();

        assertThatThrownBy(() -> config.resolvePageSize(0))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("pageSize must be positive");
        assertThatThrownBy(() -> config.resolvePageSize(-3))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void supportedWorkflowTypes_대문자로_정규화() {
        LifecycleConfig config = new LifecycleConfig().withSupportedWorkflowTypes(Set.of(" cwl ", "nextflow"));

        assertThat(config.supportsWorkflowType("CWL")).isTrue();
        assertThat(config.supportsWorkflowType("NEXTFLOW")).isTrue();
        assertThat(config.supportsWorkflowType("WDL")).isFalse();
    }

    @Test
    void supportedWorkflowTypes_비어_있으면_제한_없음() {
        LifecycleConfig config = new LifecycleConfig().withSupportedWorkflowTypes(Set.of());

        assertThat(config.supportsWorkflowType("SNAKEMAKE")).isTrue();
    }

    @Test
    void compactConstructor_잘못된_값은_거부() {
        assertThatThrownBy(() -> new LifecycleConfig().withMaxProviderFailures(0))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("maxProviderFailures must be positive (current: 0)");
        assertThatThrownBy(() -> new LifecycleConfig().withPageSizes(50, 20))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new LifecycleConfig().withDefaultProviderType(" "))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
