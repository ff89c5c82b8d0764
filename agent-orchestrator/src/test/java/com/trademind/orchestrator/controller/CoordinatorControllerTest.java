package com.trademind.orchestrator.controller;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.trademind.common.model.CoordinationMode;
import com.trademind.orchestrator.CoordinatorHarness;
import com.trademind.orchestrator.service.AgentCoordinator;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.codec.json.Jackson2JsonEncoder;
import org.springframework.test.web.reactive.server.WebTestClient;

import java.time.Duration;

class CoordinatorControllerTest {

    private final CoordinatorHarness harness = new CoordinatorHarness();
    private AgentCoordinator coordinator;
    private WebTestClient client;

    @BeforeEach
    void setUp() {
        harness.approvedScenario();
        coordinator = harness.build(CoordinationMode.BALANCED);
        ObjectMapper mapper = new ObjectMapper().registerModule(new JavaTimeModule());
        client = WebTestClient.bindToController(new CoordinatorController(coordinator))
            .httpMessageCodecs(codecs -> codecs.defaultCodecs().jackson2JsonEncoder(new Jackson2JsonEncoder(mapper)))
            .build();
    }

    @AfterEach
    void tearDown() {
        harness.close();
    }

    @Test
    void healthReportsUnavailableUntilStarted() {
        client.get().uri("/api/v1/coordinator/health").exchange()
            .expectStatus().isEqualTo(503);

        coordinator.start().block();

        client.get().uri("/api/v1/coordinator/health").exchange()
            .expectStatus().isOk()
            .expectBody(String.class).isEqualTo("OK");
    }

    @Test
    void snapshotExposesStateAndCounters() {
        harness.memory.store.initialize().block();
        coordinator.start().block();
        coordinator.runTick().block(Duration.ofSeconds(5));

        client.get().uri("/api/v1/coordinator/snapshot").exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.phase").isEqualTo("AWAITING_OUTCOME")
            .jsonPath("$.mode").isEqualTo("BALANCED")
            .jsonPath("$.degraded").isEqualTo(false)
            .jsonPath("$.tickCount").isEqualTo(1)
            .jsonPath("$.agents.length()").isEqualTo(5)
            .jsonPath("$.pendingOutcomes").isEqualTo(1)
            .jsonPath("$.performance.approved").isEqualTo(1)
            .jsonPath("$.store.mode").isEqualTo("READY");
    }

    @Test
    void decisionsAreListedNewestFirst() {
        harness.memory.store.initialize().block();
        coordinator.start().block();
        String first = coordinator.runTick().block(Duration.ofSeconds(5)).decisionId();
        String second = coordinator.runTick().block(Duration.ofSeconds(5)).decisionId();

        client.get().uri("/api/v1/coordinator/decisions?limit=5").exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.length()").isEqualTo(2)
            .jsonPath("$[0].decisionId").isEqualTo(second)
            .jsonPath("$[1].decisionId").isEqualTo(first);

        client.get().uri("/api/v1/coordinator/decisions?limit=1").exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.length()").isEqualTo(1);
    }

    @Test
    void nonPositiveLimitIsRejected() {
        client.get().uri("/api/v1/coordinator/decisions?limit=0").exchange()
            .expectStatus().isBadRequest();
    }
}
