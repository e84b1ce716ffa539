package com.chainwatch.ingestion.adapter.solana;

import com.chainwatch.common.CancellationToken;
import com.chainwatch.ingestion.adapter.RpcEndpointRotator;
import com.chainwatch.ingestion.adapter.RpcException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.reactive.socket.WebSocketMessage;
import org.springframework.web.reactive.socket.client.WebSocketClient;
import reactor.core.Disposable;
import reactor.core.Disposables;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

import java.net.URI;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * One WebSocket connection per subscription, endpoints taken round-robin from the rotator.
 */
@Slf4j
public class WebSocketSolanaSubscriptionClient implements SolanaSubscriptionClient {

    static final long SUBSCRIBE_REQUEST_ID = 1L;

    private final WebSocketClient webSocketClient;
    private final RpcEndpointRotator rotator;
    private final ObjectMapper objectMapper;

    public WebSocketSolanaSubscriptionClient(WebSocketClient webSocketClient, RpcEndpointRotator rotator,
                                             ObjectMapper objectMapper) {
        this.webSocketClient = webSocketClient;
        this.rotator = rotator;
        this.objectMapper = objectMapper;
    }

    @Override
    public Mono<Flux<JsonNode>> subscribe(String method, List<?> params, CancellationToken cancellation) {
        return Mono.defer(() -> {
            String endpoint = rotator.getNextEndpoint();
            String request = toRequest(method, params);
            Sinks.One<Flux<JsonNode>> confirmed = Sinks.one();
            Sinks.Many<JsonNode> notifications = Sinks.many().unicast().onBackpressureBuffer();
            AtomicLong subscriptionId = new AtomicLong(-1L);

            Disposable.Composite resources = Disposables.composite();

            Disposable connection = webSocketClient.execute(URI.create(endpoint), session -> {
                Mono<Void> send = session.send(Mono.just(session.textMessage(request)));
                Mono<Void> receive = session.receive()
                        .map(WebSocketMessage::getPayloadAsText)
                        .doOnNext(text -> onMessage(method, text, subscriptionId, confirmed, notifications))
                        .then();
                return send.and(receive);
            }).subscribe(
                    ignored -> { },
                    error -> {
                        resources.dispose();
                        RpcException failure = asRpcException(method, endpoint, error);
                        confirmed.tryEmitError(failure);
                        notifications.tryEmitError(failure);
                    },
                    () -> {
                        resources.dispose();
                        log.debug("{} connection to {} closed", method, endpoint);
                        confirmed.tryEmitError(new RpcException(method + ": socket closed before subscription was confirmed"));
                        notifications.tryEmitComplete();
                    });
            // a disposed composite disposes late additions, so a connection that already ended
            // releases its cancellation registration here
            resources.add(connection);
            resources.add(cancellation.onCancel(resources::dispose));

            return confirmed.asMono()
                    .doOnCancel(resources::dispose)
                    .doOnError(e -> resources.dispose())
                    .doOnNext(stream -> log.info("{} subscribed on {} (id {})", method, endpoint, subscriptionId.get()))
                    .map(stream -> stream.doFinally(signal -> resources.dispose()));
        });
    }

    private void onMessage(String method, String text, AtomicLong subscriptionId,
                           Sinks.One<Flux<JsonNode>> confirmed, Sinks.Many<JsonNode> notifications) {
        JsonNode node;
        try {
            node = objectMapper.readTree(text);
        } catch (JsonProcessingException e) {
            log.warn("Ignoring unparseable {} message: {}", method, e.getOriginalMessage());
            return;
        }
        if (node.path("id").asLong(-1L) == SUBSCRIBE_REQUEST_ID) {
            JsonNode error = node.path("error");
            if (!error.isMissingNode() && !error.isNull()) {
                Integer code = error.path("code").isInt() ? error.path("code").asInt() : null;
                confirmed.tryEmitError(new RpcException(method + " rejected: " + error, code, null));
                return;
            }
            subscriptionId.set(node.path("result").asLong(-1L));
            confirmed.tryEmitValue(notifications.asFlux());
            return;
        }
        JsonNode params = node.path("params");
        if (params.isMissingNode()) {
            return;
        }
        long id = subscriptionId.get();
        if (id >= 0 && params.path("subscription").asLong(-2L) != id) {
            return;
        }
        notifications.tryEmitNext(params.path("result"));
    }

    private String toRequest(String method, List<?> params) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("jsonrpc", "2.0");
        body.put("id", SUBSCRIBE_REQUEST_ID);
        body.put("method", method);
        body.put("params", params != null ? params : List.of());
        try {
            return objectMapper.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new RpcException("Cannot serialize " + method + " request", e);
        }
    }

    private static RpcException asRpcException(String method, String endpoint, Throwable error) {
        if (error instanceof RpcException rpc) {
            return rpc;
        }
        return new RpcException(method + " connection to " + endpoint + " failed: " + error.getMessage(), error);
    }
}
