package com.trademind.analysis.agent;

import com.trademind.analysis.portfolio.PaperPortfolioBook;
import com.trademind.common.agent.MemoryAccess;
import com.trademind.common.model.AgentCategory;
import com.trademind.common.model.AgentEvent;
import com.trademind.common.model.AgentKind;
import com.trademind.common.model.Embedding;
import com.trademind.common.model.EventKind;
import com.trademind.common.model.MemoryQuery;
import com.trademind.common.model.MemoryRecord;
import com.trademind.common.model.OutcomeLabel;
import com.trademind.common.model.RankedMemory;
import com.trademind.common.model.Signal;
import com.trademind.common.model.SignalSource;
import com.trademind.common.model.TickContext;
import com.trademind.common.model.TradeAction;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static com.trademind.analysis.agent.AgentTestSupport.*;
import static org.junit.jupiter.api.Assertions.*;

class ReferenceAgentsTest {

    // ── signal generation ───────────────────────────────────────────────────

    @Nested
    @DisplayName("signal generation")
    class SignalGeneration {

        @Test
        @DisplayName("RSI oversold → BUY on that symbol")
        void oversoldBuys() {
            SignalGeneratorAgent agent = new SignalGeneratorAgent(
                AgentDefinition.of("sig-1", AgentKind.SIGNAL_GENERATOR), MemoryAccess.NONE, SignalSource.SIMULATED);
            TickContext ctx = tick(flat("MSFT", 300), quote("AAPL", 80, -1.2, closes(80, -1, 30)));

            StepVerifier.create(agent.produceSignal(ctx))
                .assertNext(signal -> {
                    assertEquals("AAPL", signal.symbol());
                    assertEquals(TradeAction.BUY, signal.action());
                    assertEquals("sig-1", signal.agentId());
                    assertEquals(SignalSource.SIMULATED, signal.source());
                })
                .verifyComplete();
        }

        @Test
        @DisplayName("no extreme RSI → abstain")
        void neutralAbstains() {
            SignalGeneratorAgent agent = new SignalGeneratorAgent(
                AgentDefinition.of("sig-1", AgentKind.SIGNAL_GENERATOR), MemoryAccess.NONE, SignalSource.SIMULATED);
            StepVerifier.create(agent.produceSignal(tick(flat("AAPL", 100)))).verifyComplete();
        }

        @Test
        @DisplayName("cancelled tick → abstain without evaluating")
        void cancelledTick() {
            SignalGeneratorAgent agent = new SignalGeneratorAgent(
                AgentDefinition.of("sig-1", AgentKind.SIGNAL_GENERATOR), MemoryAccess.NONE, SignalSource.SIMULATED);
            TickContext ctx = tick(quote("AAPL", 80, -1.2, closes(80, -1, 30)));
            ctx.cancel();
            StepVerifier.create(agent.produceSignal(ctx)).verifyComplete();
        }

        @Test
        @DisplayName("penny scanner only looks below max price")
        void pennyScanner() {
            PennyStockScannerAgent agent = new PennyStockScannerAgent(
                AgentDefinition.of("penny", AgentKind.PENNY_STOCK_SCANNER), MemoryAccess.NONE, SignalSource.SIMULATED);
            TickContext ctx = tick(quote("AAPL", 150, 4.0, closes(150, 1, 30)),
                                   quote("PNYX", 2.5, -3.0, closes(2.5, -0.01, 30)));

            StepVerifier.create(agent.produceSignal(ctx))
                .assertNext(signal -> {
                    assertEquals("PNYX", signal.symbol());
                    assertEquals(TradeAction.SELL, signal.action());
                    assertEquals(0.7, signal.riskScore(), 1e-9);
                })
                .verifyComplete();
        }

        @Test
        @DisplayName("recursive scanner needs every window to agree")
        void recursiveScanner() {
            RecursiveScannerAgent agent = new RecursiveScannerAgent(
                AgentDefinition.of("rec", AgentKind.RECURSIVE_SCANNER), MemoryAccess.NONE, SignalSource.SIMULATED);
            List<Double> choppy = new ArrayList<>(closes(120, 1, 30));
            choppy.set(5, 130.0);

            StepVerifier.create(agent.produceSignal(tick(quote("UP", 120, 0.8, closes(120, 1, 30)),
                                                         quote("CHOP", 120, 0.8, choppy))))
                .assertNext(signal -> {
                    assertEquals("UP", signal.symbol());
                    assertEquals(TradeAction.BUY, signal.action());
                })
                .verifyComplete();
            assertEquals(2, RecursiveScannerAgent.agreeingDepth(choppy, 0, 1.0));
        }

        @Test
        @DisplayName("strategy confidence is scaled by recalled outcomes")
        void strategyUsesMemory() {
            MemoryAccess memory = new RecallOnly(List.of(
                ranked("Trade outcome SUCCESS for BUY AAPL", EventKind.OUTCOME, OutcomeLabel.SUCCESS),
                ranked("Trade outcome SUCCESS for BUY AAPL", EventKind.OUTCOME, OutcomeLabel.SUCCESS)));
            StrategyAgent agent = new StrategyAgent(
                AgentDefinition.of("strat", AgentKind.STRATEGY), memory, SignalSource.SIMULATED);

            Signal signal = agent.produceSignal(tick(quote("AAPL", 101, 1.0, closes(101, 0.5, 30)))).block();

            assertNotNull(signal);
            assertEquals(TradeAction.BUY, signal.action());
            assertEquals((0.5 + 1.0 / 5.0) * 1.2, signal.confidence(), 1e-9);
            assertEquals(2, signal.payload().get("memoriesConsulted"));
        }
    }

    // ── rule validation ─────────────────────────────────────────────────────

    @Nested
    @DisplayName("rule validation")
    class RuleValidation {

        @Test
        @DisplayName("move beyond limit → HOLD")
        void maxMoveHolds() {
            RuleSetAgent agent = new RuleSetAgent(
                AgentDefinition.of("rules", AgentKind.RULE_SET), MemoryAccess.NONE, SignalSource.SIMULATED);
            Signal signal = agent.produceSignal(tick(quote("GME", 40, 12.0, closes(40, 1, 30)))).block();
            assertNotNull(signal);
            assertEquals(TradeAction.HOLD, signal.action());
            assertEquals("max-move", signal.payload().get("rule"));
        }

        @Test
        @DisplayName("conflicting observed signals → HOLD")
        void conflictHolds() {
            RuleSetAgent agent = new RuleSetAgent(
                AgentDefinition.of("rules", AgentKind.RULE_SET), MemoryAccess.NONE, SignalSource.SIMULATED);
            agent.consumeEvent(AgentEvent.fromSignal(
                Signal.of("a", "AAPL", TradeAction.BUY, 0.8, 0.2, Map.of(), null), AgentCategory.SIGNAL_GENERATION)).block();
            agent.consumeEvent(AgentEvent.fromSignal(
                Signal.of("b", "AAPL", TradeAction.SELL, 0.7, 0.2, Map.of(), null), AgentCategory.TIMING)).block();

            Signal signal = agent.produceSignal(tick(flat("AAPL", 100))).block();

            assertNotNull(signal);
            assertEquals("conflicting-signals", signal.payload().get("rule"));
        }

        @Test
        @DisplayName("loss sale blocks the symbol inside the wash window")
        void washSale() {
            TaxEstimatorAgent agent = new TaxEstimatorAgent(
                AgentDefinition.of("tax", AgentKind.TAX_ESTIMATOR), MemoryAccess.NONE, SignalSource.SIMULATED);
            agent.consumeEvent(new AgentEvent("e1", AgentEvent.COORDINATOR_ID, AgentCategory.COORDINATION,
                EventKind.OUTCOME, "d1", "AAPL", "Trade outcome FAILURE", 0.7, NOW.minusSeconds(600),
                Map.of("pnl", -42.0))).block();

            Signal signal = agent.produceSignal(tick(flat("AAPL", 100))).block();

            assertNotNull(signal);
            assertEquals(TradeAction.HOLD, signal.action());
            StepVerifier.create(agent.produceSignal(tick(flat("MSFT", 100)))).verifyComplete();
        }
    }

    // ── risk and execution ──────────────────────────────────────────────────

    @Nested
    @DisplayName("risk and execution")
    class RiskAndExecution {

        @Test
        @DisplayName("portfolio risk attaches the book's report")
        void portfolioRiskReport() {
            PaperPortfolioBook book = new PaperPortfolioBook(100_000);
            book.open("d1", "AAPL", "IBKR", 0.08, 100.0, NOW);
            PortfolioRiskAgent agent = new PortfolioRiskAgent(
                AgentDefinition.of("risk", AgentKind.PORTFOLIO_RISK), MemoryAccess.NONE, SignalSource.SIMULATED,
                book, CLOCK);

            Signal signal = agent.produceSignal(tick(flat("MSFT", 300), flat("AAPL", 100))).block();

            assertNotNull(signal);
            assertTrue(signal.hasRiskReport());
            assertEquals("AAPL", signal.symbol());
            assertEquals(1, signal.riskReport().openPositions());
            assertEquals(0.8, signal.riskScore(), 1e-9);
        }

        @Test
        @DisplayName("approved decision is filled, held, closed and reported")
        void paperExecutionLifecycle() {
            PaperPortfolioBook book = new PaperPortfolioBook(100_000);
            FixedFeed feed = new FixedFeed().put(flat("AAPL", 100));
            List<Object[]> reported = new ArrayList<>();
            AgentDefinition def = new AgentDefinition("ibkr", AgentKind.IBKR_EXECUTION, 1.0, null, null,
                                                      Map.of("hold-ticks", "2"));
            IbkrExecutionAgent agent = new IbkrExecutionAgent(def, MemoryAccess.NONE, SignalSource.SIMULATED,
                feed, book, (id, label, pnl) -> Mono.fromRunnable(() -> reported.add(new Object[]{id, label, pnl})),
                CLOCK);

            agent.consumeEvent(approved("dec-1", "AAPL", TradeAction.BUY, 0.05)).block();
            agent.consumeEvent(approved("dec-2", "KXRAIN", TradeAction.BUY, 0.05)).block();
            assertEquals(1, book.openPositionCount());

            StepVerifier.create(agent.produceSignal(tick(flat("AAPL", 105)))).verifyComplete();
            assertTrue(reported.isEmpty());

            StepVerifier.create(agent.produceSignal(tick(flat("AAPL", 110)))).verifyComplete();
            assertEquals(1, reported.size());
            assertEquals("dec-1", reported.get(0)[0]);
            assertEquals(OutcomeLabel.SUCCESS, reported.get(0)[1]);
            assertEquals(500.0, (double) reported.get(0)[2], 1e-6);
            assertEquals(0, book.openPositionCount());
        }

        @Test
        void venuesSplitOnContractPrefix() {
            assertTrue(KalshiExecutionAgent.isContract("KXRAIN"));
            assertFalse(KalshiExecutionAgent.isContract("AAPL"));
        }
    }

    // ── learning and coordination ───────────────────────────────────────────

    @Nested
    @DisplayName("learning and coordination")
    class Learning {

        @Test
        @DisplayName("memory learner recommends the direction that worked")
        void learnerPicksSuccessfulDirection() {
            MemoryAccess memory = new RecallOnly(List.of(
                ranked("Coordination decision APPROVED: SELL AAPL size 0.040", EventKind.DECISION, OutcomeLabel.SUCCESS),
                ranked("Coordination decision APPROVED: SELL AAPL size 0.040", EventKind.DECISION, OutcomeLabel.SUCCESS),
                ranked("Trade outcome FAILURE for SELL AAPL", EventKind.OUTCOME, OutcomeLabel.FAILURE),
                ranked("Trade outcome SUCCESS for SELL AAPL", EventKind.OUTCOME, OutcomeLabel.SUCCESS),
                ranked("Trade outcome FAILURE for BUY AAPL", EventKind.OUTCOME, OutcomeLabel.FAILURE),
                ranked("Signal BUY AAPL from x", EventKind.SIGNAL, OutcomeLabel.SUCCESS)));
            MemoryLearnerAgent agent = new MemoryLearnerAgent(
                AgentDefinition.of("learner", AgentKind.MEMORY_LEARNER), memory, SignalSource.SIMULATED);

            Signal signal = agent.produceSignal(tick(flat("AAPL", 100))).block();

            assertNotNull(signal);
            assertEquals(TradeAction.SELL, signal.action());
            assertEquals(0.75 * 0.8, signal.confidence(), 1e-9);
        }

        @Test
        @DisplayName("too little history → abstain")
        void learnerAbstains() {
            MemoryLearnerAgent agent = new MemoryLearnerAgent(
                AgentDefinition.of("learner", AgentKind.MEMORY_LEARNER), MemoryAccess.NONE, SignalSource.SIMULATED);
            StepVerifier.create(agent.produceSignal(tick(flat("AAPL", 100)))).verifyComplete();
        }

        @Test
        @DisplayName("tool control suspends on rejection and restores on approval")
        void toolControl() {
            ToolControlAgent agent = new ToolControlAgent(
                AgentDefinition.of("tools", AgentKind.TOOL_CONTROL), MemoryAccess.NONE, SignalSource.SIMULATED);
            agent.consumeEvent(decisionEvent("d1", "AAPL", Map.of("verdict", "REJECTED"))).block();
            assertEquals(List.of("market-data"), new ArrayList<>(agent.enabledTools()));

            agent.consumeEvent(approved("d2", "AAPL", TradeAction.BUY, 0.02)).block();
            assertEquals(2, agent.enabledTools().size());
        }

        @Test
        void runtimeMonitorCountsDegradedDecisions() {
            RuntimeMonitorAgent agent = new RuntimeMonitorAgent(
                AgentDefinition.of("monitor", AgentKind.RUNTIME_MONITOR), MemoryAccess.NONE, SignalSource.SIMULATED);
            agent.consumeEvent(decisionEvent("d1", null, Map.of("verdict", "DEFERRED", "degraded", true))).block();

            assertEquals(1, agent.degradedDecisions());
            assertEquals(1L, agent.eventCounts().get(EventKind.DECISION));
        }
    }

    // ── helpers ─────────────────────────────────────────────────────────────

    private static AgentEvent approved(String decisionId, String symbol, TradeAction action, double size) {
        return decisionEvent(decisionId, symbol,
                             Map.of("verdict", "APPROVED", "action", action.name(), "positionSize", size));
    }

    private static AgentEvent decisionEvent(String decisionId, String symbol, Map<String, Object> attrs) {
        return new AgentEvent(UUID.randomUUID().toString(), AgentEvent.COORDINATOR_ID, AgentCategory.COORDINATION,
                              EventKind.DECISION, decisionId, symbol, "Coordination decision", 0.7, NOW, attrs);
    }

    private static RankedMemory ranked(String summary, EventKind kind, OutcomeLabel label) {
        MemoryRecord record = new MemoryRecord(UUID.randomUUID().toString(), new Embedding(new float[]{1f, 0f}),
                                               summary, "coordinator", kind, 0.8, NOW, label, "AAPL");
        return new RankedMemory(record, 0.9, 0.8);
    }

    private static final class RecallOnly implements MemoryAccess {
        private final List<RankedMemory> memories;

        RecallOnly(List<RankedMemory> memories) {
            this.memories = memories;
        }

        @Override
        public Mono<List<RankedMemory>> recall(String agentId, MemoryQuery query) {
            return Mono.just(memories);
        }

        @Override
        public Mono<Void> publish(String agentId, AgentEvent event) {
            return Mono.empty();
        }
    }
}
