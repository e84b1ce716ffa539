package com.chainwatch.ingestion.config;

import com.chainwatch.domain.Commitment;
import com.chainwatch.watcher.RetryMode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Defaults applied to every watcher started by SolanaWatchService. Documented in application.yml.
 */
@ConfigurationProperties(prefix = "chainwatch.watcher")
@NoArgsConstructor
@Getter
@Setter
public class WatcherProperties {

    private Commitment commitment = Commitment.CONFIRMED;

    /** Upper bound for establishing a subscription. */
    private long wsConnectTimeoutMs = 8_000;

    /** Account poll interval while polling; 0 = only the first poll after fallback. */
    private long accountPollIntervalMs = 5_000;

    /** Program logs poll interval while polling. */
    private long programLogsPollIntervalMs = 4_000;

    /** Failed connect attempts retried before committing to polling. */
    private int maxRetries = 3;

    /** Fixed delay between connect retries. */
    private long retryDelayMs = 2_000;

    /** Poll while streaming as a liveness check; 0 disables. */
    private long heartbeatPollMs = 0;

    private RetryMode retryMode = RetryMode.FALLBACK_TO_POLLING;

    /** PERPETUAL mode: interval of subscription attempts while polling. */
    private long pollingReconnectIntervalMs = 30_000;

    /** getSignaturesForAddress limit per program logs poll. */
    private int maxSignaturesPerPoll = 50;
}
