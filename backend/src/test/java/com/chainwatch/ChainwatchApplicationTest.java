package com.chainwatch;

import com.chainwatch.ingestion.watch.WatcherRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.reactive.AutoConfigureWebTestClient;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.reactive.server.WebTestClient;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Full context against unreachable endpoints: watchers start, fail over and can be listed and stopped.
 */
@SpringBootTest(properties = {
        "chainwatch.solana.http-urls[0]=http://localhost:1",
        "chainwatch.solana.ws-urls[0]=ws://localhost:1",
        "chainwatch.solana.retry.max-attempts=1",
        "chainwatch.watcher.ws-connect-timeout-ms=500",
        "chainwatch.watcher.max-retries=0"
})
@AutoConfigureWebTestClient
class ChainwatchApplicationTest {

    private static final String ADDRESS = "SysvarC1ock11111111111111111111111111111111";

    @Autowired
    WebTestClient webTestClient;
    @Autowired
    WatcherRegistry registry;

    @AfterEach
    void tearDown() {
        registry.stopAll();
    }

    @Test
    @DisplayName("POST, GET and DELETE a watcher through the running application")
    void watcherLifecycle() {
        Map<?, ?> started = webTestClient.post().uri("/api/v1/watchers/accounts")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"address\":\"" + ADDRESS + "\"}")
                .exchange()
                .expectStatus().isAccepted()
                .expectBody(Map.class)
                .returnResult()
                .getResponseBody();
        assertThat(started).isNotNull();
        String id = (String) started.get("id");

        webTestClient.get().uri("/api/v1/watchers")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$[0].id").isEqualTo(id)
                .jsonPath("$[0].target").isEqualTo(ADDRESS);

        webTestClient.delete().uri("/api/v1/watchers/" + id)
                .exchange()
                .expectStatus().isNoContent();
        assertThat(registry.list()).isEmpty();
    }
}
