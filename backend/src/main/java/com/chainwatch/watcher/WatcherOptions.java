package com.chainwatch.watcher;

import com.chainwatch.common.CancellationToken;
import com.chainwatch.common.RetryPolicy;
import lombok.Getter;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * Timing, retry policy and callbacks of one watcher. Only {@code onUpdate} is required.
 */
@Getter
public final class WatcherOptions<N> {

    public static final Duration DEFAULT_WS_CONNECT_TIMEOUT = Duration.ofMillis(8_000);
    public static final Duration DEFAULT_POLL_INTERVAL = Duration.ofMillis(5_000);
    public static final int DEFAULT_MAX_RETRIES = 3;
    public static final Duration DEFAULT_RETRY_DELAY = Duration.ofMillis(2_000);
    public static final Duration DEFAULT_POLLING_RECONNECT_INTERVAL = Duration.ofMillis(30_000);

    private final String name;
    private final Duration wsConnectTimeout;
    /** Zero disables periodic polling; the first poll after fallback still runs. */
    private final Duration pollInterval;
    /** Zero disables heartbeat polling while streaming. */
    private final Duration heartbeatPollInterval;
    private final RetryPolicy reconnectPolicy;
    private final RetryMode retryMode;
    /** PERPETUAL only: how often a new subscription is attempted while polling; zero disables. */
    private final Duration pollingReconnectInterval;
    private final UpdateListener<N> onUpdate;
    private final Consumer<Throwable> onError;
    private final CancellationToken parentToken;
    private final Scheduler scheduler;

    private WatcherOptions(Builder<N> b) {
        this.name = b.name;
        this.wsConnectTimeout = b.wsConnectTimeout;
        this.pollInterval = b.pollInterval;
        this.heartbeatPollInterval = b.heartbeatPollInterval;
        this.reconnectPolicy = b.reconnectPolicy != null
                ? b.reconnectPolicy
                : RetryPolicy.fixed(b.retryDelay.toMillis(), b.maxRetries);
        this.retryMode = b.retryMode;
        this.pollingReconnectInterval = b.pollingReconnectInterval;
        this.onUpdate = b.onUpdate;
        this.onError = b.onError;
        this.parentToken = b.parentToken;
        this.scheduler = b.scheduler;
    }

    public static <N> Builder<N> builder() {
        return new Builder<>();
    }

    public int getMaxRetries() {
        return reconnectPolicy.getMaxAttempts();
    }

    public static final class Builder<N> {

        private String name = "watcher";
        private Duration wsConnectTimeout = DEFAULT_WS_CONNECT_TIMEOUT;
        private Duration pollInterval = DEFAULT_POLL_INTERVAL;
        private Duration heartbeatPollInterval = Duration.ZERO;
        private int maxRetries = DEFAULT_MAX_RETRIES;
        private Duration retryDelay = DEFAULT_RETRY_DELAY;
        private RetryPolicy reconnectPolicy;
        private RetryMode retryMode = RetryMode.FALLBACK_TO_POLLING;
        private Duration pollingReconnectInterval = DEFAULT_POLLING_RECONNECT_INTERVAL;
        private UpdateListener<N> onUpdate;
        private Consumer<Throwable> onError = e -> { };
        private CancellationToken parentToken;
        private Scheduler scheduler = Schedulers.parallel();

        private Builder() {
        }

        public Builder<N> name(String name) {
            this.name = name;
            return this;
        }

        public Builder<N> wsConnectTimeout(Duration wsConnectTimeout) {
            this.wsConnectTimeout = wsConnectTimeout;
            return this;
        }

        public Builder<N> pollInterval(Duration pollInterval) {
            this.pollInterval = pollInterval != null ? pollInterval : Duration.ZERO;
            return this;
        }

        public Builder<N> heartbeatPollInterval(Duration heartbeatPollInterval) {
            this.heartbeatPollInterval = heartbeatPollInterval != null ? heartbeatPollInterval : Duration.ZERO;
            return this;
        }

        public Builder<N> maxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
            return this;
        }

        public Builder<N> retryDelay(Duration retryDelay) {
            this.retryDelay = retryDelay;
            return this;
        }

        /**
         * Replaces the fixed maxRetries/retryDelay schedule, e.g. with an exponential {@link RetryPolicy}.
         */
        public Builder<N> reconnectPolicy(RetryPolicy reconnectPolicy) {
            this.reconnectPolicy = reconnectPolicy;
            return this;
        }

        public Builder<N> retryMode(RetryMode retryMode) {
            this.retryMode = retryMode;
            return this;
        }

        public Builder<N> pollingReconnectInterval(Duration pollingReconnectInterval) {
            this.pollingReconnectInterval = pollingReconnectInterval != null ? pollingReconnectInterval : Duration.ZERO;
            return this;
        }

        public Builder<N> onUpdate(UpdateListener<N> onUpdate) {
            this.onUpdate = onUpdate;
            return this;
        }

        public Builder<N> onError(Consumer<Throwable> onError) {
            this.onError = onError != null ? onError : e -> { };
            return this;
        }

        /**
         * External token: cancelling it stops the watcher.
         */
        public Builder<N> parentToken(CancellationToken parentToken) {
            this.parentToken = parentToken;
            return this;
        }

        public Builder<N> scheduler(Scheduler scheduler) {
            this.scheduler = scheduler;
            return this;
        }

        /**
         * @throws IllegalArgumentException when a required option is missing or a value is out of range
         */
        public WatcherOptions<N> build() {
            if (onUpdate == null) {
                throw new IllegalArgumentException("onUpdate is required");
            }
            if (wsConnectTimeout == null || wsConnectTimeout.isZero() || wsConnectTimeout.isNegative()) {
                throw new IllegalArgumentException("wsConnectTimeout must be positive");
            }
            requireNotNegative(pollInterval, "pollInterval");
            requireNotNegative(heartbeatPollInterval, "heartbeatPollInterval");
            requireNotNegative(pollingReconnectInterval, "pollingReconnectInterval");
            if (reconnectPolicy == null) {
                if (maxRetries < 0) {
                    throw new IllegalArgumentException("maxRetries must not be negative");
                }
                requireNotNegative(retryDelay, "retryDelay");
            }
            Objects.requireNonNull(retryMode, "retryMode");
            Objects.requireNonNull(scheduler, "scheduler");
            if (name == null || name.isBlank()) {
                name = "watcher";
            }
            return new WatcherOptions<>(this);
        }

        private static void requireNotNegative(Duration value, String field) {
            if (value == null || value.isNegative()) {
                throw new IllegalArgumentException(field + " must not be negative");
            }
        }
    }
}
