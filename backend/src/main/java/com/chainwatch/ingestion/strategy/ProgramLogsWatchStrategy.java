package com.chainwatch.ingestion.strategy;

import com.chainwatch.common.CancellationToken;
import com.chainwatch.domain.Commitment;
import com.chainwatch.domain.LogsFilter;
import com.chainwatch.domain.TransactionLog;
import com.chainwatch.ingestion.adapter.solana.SolanaRpcGateway;
import com.chainwatch.ingestion.adapter.solana.SolanaSubscriptionClient;
import com.chainwatch.watcher.PollEmission;
import com.chainwatch.watcher.PollEmitter;
import com.chainwatch.watcher.SubscriptionItem;
import com.chainwatch.watcher.WatcherStrategy;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Logs of transactions mentioning one program. Pushes come from logsSubscribe; polls walk
 * getSignaturesForAddress(programId) since the last processed signature, oldest first, and fetch each
 * transaction's log messages.
 */
@Slf4j
public class ProgramLogsWatchStrategy implements WatcherStrategy<JsonNode, TransactionLog> {

    private final String programId;
    private final Commitment commitment;
    private final int maxSignaturesPerPoll;
    private final SolanaRpcGateway rpcGateway;
    private final SolanaSubscriptionClient subscriptionClient;

    /** Poll cursor: newest signature already handled. */
    private final AtomicReference<String> lastProcessedSignature = new AtomicReference<>();

    public ProgramLogsWatchStrategy(String programId, Commitment commitment, int maxSignaturesPerPoll,
                                    SolanaRpcGateway rpcGateway, SolanaSubscriptionClient subscriptionClient) {
        this.programId = programId;
        this.commitment = commitment != null ? commitment : Commitment.CONFIRMED;
        this.maxSignaturesPerPoll = Math.min(Math.max(1, maxSignaturesPerPoll), 1000);
        this.rpcGateway = rpcGateway;
        this.subscriptionClient = subscriptionClient;
    }

    @Override
    public Mono<Flux<SubscriptionItem<JsonNode>>> subscribe(CancellationToken cancellation) {
        List<Object> params = List.of(
                LogsFilter.mentions(programId).toRpcParam(),
                Map.of("commitment", commitment.rpcValue()));
        return subscriptionClient.subscribe("logsSubscribe", params, cancellation)
                .map(stream -> stream.map(RpcValues::toItem));
    }

    @Override
    public boolean hasPoll() {
        return true;
    }

    @Override
    public Mono<Void> poll(PollEmitter<TransactionLog> emitter, CancellationToken cancellation) {
        Map<String, Object> config = new HashMap<>();
        config.put("commitment", historyCommitment());
        config.put("limit", maxSignaturesPerPoll);
        String cursor = lastProcessedSignature.get();
        if (cursor != null) {
            config.put("until", cursor);
        }
        return rpcGateway.call("getSignaturesForAddress", List.of(programId, config))
                .flatMapMany(result -> Flux.fromIterable(oldestFirst(result)))
                .takeWhile(signatureInfo -> !cancellation.isCancelled())
                .concatMap(signatureInfo -> processSignature(signatureInfo, emitter, cancellation))
                .then();
    }

    private Mono<Void> processSignature(JsonNode signatureInfo, PollEmitter<TransactionLog> emitter,
                                        CancellationToken cancellation) {
        String signature = signatureInfo.path("signature").asText(null);
        if (signature == null || signature.equals(lastProcessedSignature.get())) {
            return Mono.empty();
        }
        Map<String, Object> txConfig = Map.of(
                "commitment", historyCommitment(),
                "encoding", "json",
                "maxSupportedTransactionVersion", 0);
        return rpcGateway.call("getTransaction", List.of(signature, txConfig))
                .doOnNext(tx -> {
                    JsonNode logMessages = tx.path("meta").path("logMessages");
                    if (!logMessages.isArray() || cancellation.isCancelled()) {
                        return;
                    }
                    List<String> lines = RpcValues.lines(logMessages);
                    TransactionLog entry = new TransactionLog(signature, RpcValues.errText(tx.path("meta").path("err")), lines);
                    if (entry.mentions(programId)) {
                        long slot = tx.path("slot").isIntegralNumber()
                                ? tx.path("slot").asLong()
                                : signatureInfo.path("slot").asLong();
                        emitter.emit(PollEmission.at(slot, entry));
                    }
                    lastProcessedSignature.set(signature);
                })
                .onErrorResume(e -> {
                    log.warn("Error fetching transaction {} for program {}: {}", signature, programId, e.getMessage());
                    return Mono.empty();
                })
                .then();
    }

    @Override
    public TransactionLog normalize(JsonNode raw) {
        try {
            return RpcValues.toTransactionLog(raw);
        } catch (RuntimeException e) {
            return null;
        }
    }

    public String getProgramId() {
        return programId;
    }

    String getLastProcessedSignature() {
        return lastProcessedSignature.get();
    }

    /** getSignaturesForAddress / getTransaction do not accept "processed". */
    private String historyCommitment() {
        return commitment == Commitment.PROCESSED ? Commitment.CONFIRMED.rpcValue() : commitment.rpcValue();
    }

    private static List<JsonNode> oldestFirst(JsonNode result) {
        if (!result.isArray() || result.isEmpty()) {
            return List.of();
        }
        List<JsonNode> list = new ArrayList<>();
        result.forEach(list::add);
        Collections.reverse(list);
        return list;
    }
}
