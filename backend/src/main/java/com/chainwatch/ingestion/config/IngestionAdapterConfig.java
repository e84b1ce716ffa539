package com.chainwatch.ingestion.config;

import com.chainwatch.common.RetryPolicy;
import com.chainwatch.ingestion.adapter.RpcEndpointRotator;
import com.chainwatch.ingestion.adapter.solana.SolanaRpcClient;
import com.chainwatch.ingestion.adapter.solana.SolanaRpcGateway;
import com.chainwatch.ingestion.adapter.solana.SolanaSubscriptionClient;
import com.chainwatch.ingestion.adapter.solana.WebClientSolanaRpcClient;
import com.chainwatch.ingestion.adapter.solana.WebSocketSolanaSubscriptionClient;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.socket.client.ReactorNettyWebSocketClient;
import org.springframework.web.reactive.socket.client.WebSocketClient;

import java.time.Duration;

/**
 * Wires the Solana transports: HTTP gateway (polls) and WebSocket subscription client (pushes),
 * each with its own endpoint rotator.
 */
@Configuration
@EnableConfigurationProperties({ SolanaRpcProperties.class, WatcherProperties.class, WatchTargetsProperties.class })
public class IngestionAdapterConfig {

    public static final String HTTP_ROTATOR = "solanaHttpRotator";
    public static final String WS_ROTATOR = "solanaWsRotator";

    private static RetryPolicy rpcRetryPolicy(SolanaRpcProperties properties) {
        SolanaRpcProperties.Retry retry = properties.getRetry();
        return new RetryPolicy(retry.getBaseDelayMs(), retry.getJitterFactor(), retry.getMaxAttempts());
    }

    @Bean(name = HTTP_ROTATOR)
    public RpcEndpointRotator solanaHttpRotator(SolanaRpcProperties properties) {
        return new RpcEndpointRotator("http", properties.getHttpUrls(), rpcRetryPolicy(properties));
    }

    @Bean(name = WS_ROTATOR)
    public RpcEndpointRotator solanaWsRotator(SolanaRpcProperties properties) {
        return new RpcEndpointRotator("ws", properties.getWsUrls(), rpcRetryPolicy(properties));
    }

    @Bean
    public SolanaRpcClient solanaRpcClient(WebClient.Builder webClientBuilder, SolanaRpcProperties properties) {
        return new WebClientSolanaRpcClient(webClientBuilder, Duration.ofMillis(properties.getRequestTimeoutMs()));
    }

    @Bean(name = "solanaRpcRateLimiter")
    public RateLimiter solanaRpcRateLimiter(SolanaRpcProperties properties) {
        int rps = Math.max(1, properties.getMaxRequestsPerSecond());
        RateLimiterConfig config = RateLimiterConfig.custom()
                .limitRefreshPeriod(Duration.ofSeconds(1))
                .limitForPeriod(rps)
                .timeoutDuration(Duration.ofMillis(Math.max(0L, properties.getLimiterTimeoutMs())))
                .build();
        return RateLimiter.of("solana-rpc", config);
    }

    @Bean
    public SolanaRpcGateway solanaRpcGateway(SolanaRpcClient solanaRpcClient,
                                             @Qualifier(HTTP_ROTATOR) RpcEndpointRotator rotator,
                                             @Qualifier("solanaRpcRateLimiter") RateLimiter rateLimiter,
                                             ObjectMapper objectMapper) {
        return new SolanaRpcGateway(solanaRpcClient, rotator, rateLimiter, objectMapper);
    }

    @Bean
    public WebSocketClient webSocketClient() {
        return new ReactorNettyWebSocketClient();
    }

    @Bean
    public SolanaSubscriptionClient solanaSubscriptionClient(WebSocketClient webSocketClient,
                                                             @Qualifier(WS_ROTATOR) RpcEndpointRotator rotator,
                                                             ObjectMapper objectMapper) {
        return new WebSocketSolanaSubscriptionClient(webSocketClient, rotator, objectMapper);
    }
}
