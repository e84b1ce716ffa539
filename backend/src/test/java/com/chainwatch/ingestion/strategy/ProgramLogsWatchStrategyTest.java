package com.chainwatch.ingestion.strategy;

import com.chainwatch.common.CancellationToken;
import com.chainwatch.domain.Commitment;
import com.chainwatch.domain.TransactionLog;
import com.chainwatch.ingestion.adapter.RpcException;
import com.chainwatch.ingestion.adapter.solana.SolanaRpcGateway;
import com.chainwatch.ingestion.adapter.solana.SolanaSubscriptionClient;
import com.chainwatch.watcher.PollEmission;
import com.chainwatch.watcher.SubscriptionItem;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ProgramLogsWatchStrategyTest {

    private static final String PROGRAM = "TokenkegQfeZyiNwAJbNbGKPFXCWuBvf9Ss623VQ5DA";
    private static final ObjectMapper MAPPER = new ObjectMapper();

    @Mock
    SolanaRpcGateway rpcGateway;
    @Mock
    SolanaSubscriptionClient subscriptionClient;

    private ProgramLogsWatchStrategy strategy;

    @BeforeEach
    void setUp() {
        strategy = new ProgramLogsWatchStrategy(PROGRAM, Commitment.CONFIRMED, 50, rpcGateway, subscriptionClient);
    }

    private static JsonNode json(String text) throws Exception {
        return MAPPER.readTree(text);
    }

    private static Object signatureParam(String signature) {
        return argThat((Object params) -> params instanceof List<?> list && signature.equals(list.get(0)));
    }

    private static JsonNode transaction(long slot, String err, String... logs) throws Exception {
        Map<String, Object> meta = new java.util.HashMap<>();
        meta.put("err", err == null ? null : Map.of("InstructionError", List.of(0, err)));
        meta.put("logMessages", List.of(logs));
        return MAPPER.valueToTree(Map.of("slot", slot, "meta", meta));
    }

    @Test
    @DisplayName("poll walks signatures oldest first and emits logs mentioning the program")
    void poll_emitsOldestFirst() throws Exception {
        when(rpcGateway.call(eq("getSignaturesForAddress"), any())).thenReturn(Mono.just(json("""
                [{"signature":"sig3","slot":12},{"signature":"sig2","slot":11},{"signature":"sig1","slot":10}]
                """)));
        when(rpcGateway.call(eq("getTransaction"), signatureParam("sig1")))
                .thenReturn(Mono.just(transaction(10, null, "Program " + PROGRAM + " invoke [1]")));
        when(rpcGateway.call(eq("getTransaction"), signatureParam("sig2")))
                .thenReturn(Mono.just(transaction(11, null, "Program 11111111111111111111111111111111 invoke [1]")));
        when(rpcGateway.call(eq("getTransaction"), signatureParam("sig3")))
                .thenReturn(Mono.just(transaction(12, "Custom", "Program " + PROGRAM + " failed")));
        List<PollEmission<TransactionLog>> emitted = new ArrayList<>();

        strategy.poll(emitted::add, CancellationToken.create()).block();

        assertThat(emitted).extracting(PollEmission::slot).containsExactly(10L, 12L);
        assertThat(emitted).extracting(e -> e.value().signature()).containsExactly("sig1", "sig3");
        assertThat(emitted.get(1).value().failed()).isTrue();
        assertThat(strategy.getLastProcessedSignature()).isEqualTo("sig3");
    }

    @Test
    @DisplayName("next poll only asks for signatures newer than the cursor")
    @SuppressWarnings("unchecked")
    void poll_usesCursorOnNextPoll() throws Exception {
        ArgumentCaptor<Object> params = ArgumentCaptor.forClass(Object.class);
        when(rpcGateway.call(eq("getSignaturesForAddress"), params.capture()))
                .thenReturn(Mono.just(json("[{\"signature\":\"sig1\",\"slot\":10}]")))
                .thenReturn(Mono.just(json("[]")));
        when(rpcGateway.call(eq("getTransaction"), any()))
                .thenReturn(Mono.just(transaction(10, null, "Program " + PROGRAM + " invoke [1]")));

        strategy.poll(e -> { }, CancellationToken.create()).block();
        strategy.poll(e -> { }, CancellationToken.create()).block();

        Map<String, Object> first = (Map<String, Object>) ((List<Object>) params.getAllValues().get(0)).get(1);
        Map<String, Object> second = (Map<String, Object>) ((List<Object>) params.getAllValues().get(1)).get(1);
        assertThat(first).containsEntry("limit", 50).doesNotContainKey("until");
        assertThat(second).containsEntry("until", "sig1").containsEntry("commitment", "confirmed");
        verify(rpcGateway, times(1)).call(eq("getTransaction"), any());
    }

    @Test
    @DisplayName("a failing transaction fetch is skipped without stopping the poll")
    void poll_failingTransactionSkipped() throws Exception {
        when(rpcGateway.call(eq("getSignaturesForAddress"), any())).thenReturn(Mono.just(json("""
                [{"signature":"sig2","slot":11},{"signature":"sig1","slot":10}]
                """)));
        when(rpcGateway.call(eq("getTransaction"), signatureParam("sig1")))
                .thenReturn(Mono.error(new RpcException("getTransaction failed after 3 attempts")));
        when(rpcGateway.call(eq("getTransaction"), signatureParam("sig2")))
                .thenReturn(Mono.just(transaction(11, null, "Program " + PROGRAM + " success")));
        List<PollEmission<TransactionLog>> emitted = new ArrayList<>();

        strategy.poll(emitted::add, CancellationToken.create()).block();

        assertThat(emitted).extracting(e -> e.value().signature()).containsExactly("sig2");
        assertThat(strategy.getLastProcessedSignature()).isEqualTo("sig2");
    }

    @Test
    void poll_cancelled_fetchesNoTransactions() throws Exception {
        when(rpcGateway.call(eq("getSignaturesForAddress"), any()))
                .thenReturn(Mono.just(json("[{\"signature\":\"sig1\",\"slot\":10}]")));
        CancellationToken token = CancellationToken.create();
        token.cancel();

        strategy.poll(e -> { }, token).block();

        verify(rpcGateway, never()).call(eq("getTransaction"), any());
        assertThat(strategy.getLastProcessedSignature()).isNull();
    }

    @Test
    @DisplayName("subscribes with a mentions filter and normalizes log notifications")
    void subscribe_mentionsFilter() throws Exception {
        JsonNode notification = json("""
                {"context":{"slot":77},"value":{"signature":"sigX","err":null,"logs":["Program %s invoke [1]"]}}
                """.formatted(PROGRAM));
        when(subscriptionClient.subscribe(eq("logsSubscribe"), anyList(), any()))
                .thenReturn(Mono.just(Flux.just(notification)));

        SubscriptionItem<JsonNode> item = strategy.subscribe(CancellationToken.create())
                .flatMapMany(stream -> stream)
                .blockFirst();

        verify(subscriptionClient).subscribe(eq("logsSubscribe"),
                eq(List.of(Map.of("mentions", List.of(PROGRAM)), Map.of("commitment", "confirmed"))), any());
        assertThat(item).isEqualTo(SubscriptionItem.enveloped(77, notification.path("value")));
        TransactionLog log = strategy.normalize(item.value());
        assertThat(log.signature()).isEqualTo("sigX");
        assertThat(log.failed()).isFalse();
        assertThat(log.mentions(PROGRAM)).isTrue();
    }

    @Test
    void processedCommitment_usesConfirmedForHistory() throws Exception {
        ProgramLogsWatchStrategy processed = new ProgramLogsWatchStrategy(
                PROGRAM, Commitment.PROCESSED, 5000, rpcGateway, subscriptionClient);
        ArgumentCaptor<Object> params = ArgumentCaptor.forClass(Object.class);
        when(rpcGateway.call(eq("getSignaturesForAddress"), params.capture())).thenReturn(Mono.just(json("[]")));

        processed.poll(e -> { }, CancellationToken.create()).block();

        @SuppressWarnings("unchecked")
        Map<String, Object> config = (Map<String, Object>) ((List<Object>) params.getValue()).get(1);
        assertThat(config).containsEntry("commitment", "confirmed").containsEntry("limit", 1000);
    }
}
