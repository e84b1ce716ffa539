package com.chainwatch.ingestion.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Solana endpoints and RPC call limits. HTTP URLs serve polls, WebSocket URLs serve subscriptions;
 * both are used round-robin.
 */
@ConfigurationProperties(prefix = "chainwatch.solana")
@NoArgsConstructor
@Getter
@Setter
public class SolanaRpcProperties {

    private List<String> httpUrls = new ArrayList<>(List.of("https://api.mainnet-beta.solana.com"));

    private List<String> wsUrls = new ArrayList<>(List.of("wss://api.mainnet-beta.solana.com"));

    /** Upper bound for a single HTTP RPC call. */
    private long requestTimeoutMs = 10_000;

    /** Local budget for HTTP RPC calls (requests per second) shared by all watchers. */
    private int maxRequestsPerSecond = 20;

    /** How long a call may wait for a local limiter permit before failing. */
    private long limiterTimeoutMs = 2_000;

    private Retry retry = new Retry();

    public void setHttpUrls(List<String> httpUrls) {
        this.httpUrls = httpUrls != null ? httpUrls : new ArrayList<>();
    }

    public void setWsUrls(List<String> wsUrls) {
        this.wsUrls = wsUrls != null ? wsUrls : new ArrayList<>();
    }

    /**
     * Per-call retry for HTTP RPC (exponential backoff ± jitter), independent of watcher reconnects.
     */
    @NoArgsConstructor
    @Getter
    @Setter
    public static class Retry {

        private long baseDelayMs = 500L;

        /** 0..1, e.g. 0.2 = ±20%. */
        private double jitterFactor = 0.2;

        /** Attempts including the first call. */
        private int maxAttempts = 3;
    }
}
