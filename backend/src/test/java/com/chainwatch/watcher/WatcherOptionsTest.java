package com.chainwatch.watcher;

import com.chainwatch.common.RetryPolicy;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class WatcherOptionsTest {

    @Test
    void build_appliesDefaults() {
        WatcherOptions<String> options = WatcherOptions.<String>builder()
                .onUpdate((slot, value) -> { })
                .build();

        assertThat(options.getWsConnectTimeout()).isEqualTo(Duration.ofMillis(8000));
        assertThat(options.getPollInterval()).isEqualTo(Duration.ofMillis(5000));
        assertThat(options.getMaxRetries()).isEqualTo(3);
        assertThat(options.getReconnectPolicy().delayMs(0)).isEqualTo(2000L);
        assertThat(options.getReconnectPolicy().delayMs(2)).isEqualTo(2000L);
        assertThat(options.getHeartbeatPollInterval()).isZero();
        assertThat(options.getRetryMode()).isEqualTo(RetryMode.FALLBACK_TO_POLLING);
        assertThat(options.getName()).isEqualTo("watcher");
        assertThat(options.getOnError()).isNotNull();
    }

    @Test
    void build_customReconnectPolicyReplacesFixedSchedule() {
        WatcherOptions<String> options = WatcherOptions.<String>builder()
                .onUpdate((slot, value) -> { })
                .maxRetries(9)
                .reconnectPolicy(new RetryPolicy(100L, 0, 4))
                .build();

        assertThat(options.getMaxRetries()).isEqualTo(4);
        assertThat(options.getReconnectPolicy().delayMs(1)).isEqualTo(200L);
    }

    @Test
    void build_rejectsInvalidValues() {
        assertThatThrownBy(() -> WatcherOptions.<String>builder().build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("onUpdate");
        assertThatThrownBy(() -> WatcherOptions.<String>builder().onUpdate((s, v) -> { })
                .wsConnectTimeout(Duration.ZERO).build())
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> WatcherOptions.<String>builder().onUpdate((s, v) -> { })
                .pollInterval(Duration.ofMillis(-1)).build())
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> WatcherOptions.<String>builder().onUpdate((s, v) -> { })
                .maxRetries(-1).build())
                .isInstanceOf(IllegalArgumentException.class);
    }
}
