package com.trademind.memory.routing;

import com.trademind.common.agent.AgentDirectory;
import com.trademind.common.model.AgentCategory;
import com.trademind.common.model.AgentEvent;
import com.trademind.common.model.AgentKind;
import com.trademind.common.model.EventKind;
import com.trademind.common.model.OutcomeLabel;
import com.trademind.common.model.Signal;
import com.trademind.common.model.SignalSource;
import com.trademind.common.model.TradeAction;
import com.trademind.memory.MemoryTestSupport;
import com.trademind.memory.MemoryTestSupport.Fixture;
import com.trademind.memory.store.FailingMetadataTable;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.EnumSet;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class AgentOutputRouterTest {

    private static final DeliveryPolicy FAST = new DeliveryPolicy(Duration.ofMillis(200), 1);

    private static AgentEvent signalEvent(String agentId) {
        Signal s = Signal.of(agentId, "AAPL", TradeAction.BUY, 0.8, 0.2, Map.of(), SignalSource.SIMULATED);
        return AgentEvent.fromSignal(s, AgentCategory.SIGNAL_GENERATION);
    }

    private static AgentOutputRouter router(Fixture f, AgentDirectory directory, ImportancePolicy importance) {
        return new AgentOutputRouter(MemoryTestSupport.EMBEDDER, f.store, directory, importance, FAST);
    }

    // ── fan-out ──────────────────────────────────────────────────────────────

    @Nested
    @DisplayName("fan-out")
    class FanOut {

        @Test
        @DisplayName("only interested agents are notified and never the emitter")
        void interestedSubscribersOnly() {
            StubAgent emitter = new StubAgent("sig-1", AgentKind.SIGNAL_GENERATOR,
                EnumSet.of(AgentCategory.SIGNAL_GENERATION));
            StubAgent interested = new StubAgent("risk-1", AgentKind.PORTFOLIO_RISK,
                EnumSet.of(AgentCategory.SIGNAL_GENERATION));
            StubAgent bystander = new StubAgent("tax-1", AgentKind.TAX_ESTIMATOR,
                EnumSet.of(AgentCategory.EXECUTION));
            Fixture f = MemoryTestSupport.h2Store();
            AgentOutputRouter router = router(f, StubAgent.directoryOf(emitter, interested, bystander),
                                              ImportancePolicy.defaults());

            IngestResult result = router.ingest("sig-1", signalEvent("sig-1")).block();

            assertEquals(1, result.delivered());
            assertEquals(0, result.failed());
            assertEquals(1, interested.received.size());
            assertTrue(emitter.received.isEmpty());
            assertTrue(bystander.received.isEmpty());
        }

        @Test
        @DisplayName("a failing subscriber is retried, then counted, without blocking others")
        void failingSubscriberIsolated() {
            StubAgent broken = new StubAgent("broken", AgentKind.RULE_SET, EnumSet.of(AgentCategory.SIGNAL_GENERATION),
                attempt -> Mono.error(new IllegalStateException("boom")));
            StubAgent slow = new StubAgent("slow", AgentKind.MARKET_TIMING, EnumSet.of(AgentCategory.SIGNAL_GENERATION),
                attempt -> Mono.never());
            StubAgent healthy = new StubAgent("healthy", AgentKind.PORTFOLIO_RISK,
                EnumSet.of(AgentCategory.SIGNAL_GENERATION));
            Fixture f = MemoryTestSupport.h2Store();
            AgentOutputRouter router = router(f, StubAgent.directoryOf(broken, slow, healthy),
                                              ImportancePolicy.defaults());

            IngestResult result = router.ingest("sig-1", signalEvent("sig-1")).block(Duration.ofSeconds(5));

            assertEquals(1, result.delivered());
            assertEquals(2, result.failed());
            assertEquals(2, broken.attempts.get());
            assertEquals(1, healthy.received.size());
            assertEquals(2, router.stats().deliveryFailures());
        }

        @Test
        @DisplayName("persistence fault still completes fan-out")
        void fanOutSurvivesPersistenceFault() {
            StubAgent subscriber = new StubAgent("risk-1", AgentKind.PORTFOLIO_RISK,
                EnumSet.of(AgentCategory.SIGNAL_GENERATION));
            Fixture f = MemoryTestSupport.h2Store(index -> index,
                FailingMetadataTable::new);
            AgentOutputRouter router = router(f, StubAgent.directoryOf(subscriber),
                new ImportancePolicy(0.5, 0.2, 0.3, 0.0, 1.0));

            IngestResult result = router.ingest("sig-1", signalEvent("sig-1")).block();

            assertFalse(result.stored());
            assertTrue(result.persistenceFailed());
            assertEquals(1, result.delivered());
            assertEquals(0, f.store.size());
            assertEquals(1, router.stats().persistenceFailures());
        }
    }

    // ── importance ───────────────────────────────────────────────────────────

    @Nested
    @DisplayName("importance admission")
    class Importance {

        @Test
        @DisplayName("a novel event above the threshold is stored")
        void novelEventStored() {
            Fixture f = MemoryTestSupport.h2Store();
            AgentOutputRouter router = router(f, StubAgent.directoryOf(), ImportancePolicy.defaults());

            IngestResult result = router.ingest("coordinator", signalEvent("coordinator")).block();

            // 0.5 × 0.4 + 0.2 × 1.0 + 0.3 × 1.0
            assertEquals(0.7, result.importance(), 1e-9);
            assertTrue(result.stored());
            assertEquals(EventKind.SIGNAL, f.store.get(result.recordId()).block().eventKind());
        }

        @Test
        @DisplayName("a repeated event loses novelty and can fall below the threshold")
        void duplicateEventSkipped() {
            Fixture f = MemoryTestSupport.h2Store();
            ImportancePolicy policy = new ImportancePolicy(0.5, 0.2, 0.3, 0.6, 1.0);
            AgentOutputRouter router = router(f, StubAgent.directoryOf(), policy);
            AgentEvent event = signalEvent("coordinator");

            IngestResult first = router.ingest("coordinator", event).block();
            IngestResult second = router.ingest("coordinator", event).block();

            assertTrue(first.stored());
            assertFalse(second.stored());
            assertNull(second.recordId());
            assertEquals(0.4, second.importance(), 1e-5);
            assertEquals(1, f.store.size());
        }
    }

    @Test
    @DisplayName("annotateOutcome labels the stored record")
    void annotateOutcome() {
        Fixture f = MemoryTestSupport.h2Store();
        AgentOutputRouter router = router(f, StubAgent.directoryOf(), ImportancePolicy.defaults());
        String id = router.ingest("coordinator", signalEvent("coordinator")).block().recordId();

        assertTrue(router.annotateOutcome(id, OutcomeLabel.SUCCESS).block());
        assertEquals(OutcomeLabel.SUCCESS, f.store.get(id).block().outcomeLabel());
    }
}
