package com.ryuqq.wes.adapter.notification;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class NotificationConfigTest {

    @Test
    void 기본값() {
        NotificationConfig config = new NotificationConfig();

        assertThat(config.host()).isEqualTo("localhost");
        assertThat(config.port()).isEqualTo(5001);
        assertThat(config.path()).isEqualTo("/notify");
        assertThat(config.endpoint().toString()).isEqualTo("http://localhost:5001/notify");
    }

    @Test
    void 잘못된_값은_거부한다() {
        NotificationConfig config = new NotificationConfig();

        assertThatThrownBy(() -> config.withPort(70000))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("port");
        assertThatThrownBy(() -> config.withPath("notify"))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> config.withHost(" "))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> config.withClientTimeoutMs(0))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
