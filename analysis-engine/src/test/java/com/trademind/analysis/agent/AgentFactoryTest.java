package com.trademind.analysis.agent;

import com.trademind.analysis.portfolio.PaperPortfolioBook;
import com.trademind.common.agent.MemoryAccess;
import com.trademind.common.agent.TradingAgent;
import com.trademind.common.model.AgentCategory;
import com.trademind.common.model.AgentKind;
import com.trademind.common.model.OutcomeLabel;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.util.EnumSet;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class AgentFactoryTest {

    private final OutcomeRelay relay = new OutcomeRelay();
    private final AgentFactory factory = new AgentFactory(MemoryAccess.NONE, new AgentTestSupport.FixedFeed(),
        new PaperPortfolioBook(100_000), relay, AgentTestSupport.CLOCK);

    @ParameterizedTest
    @EnumSource(AgentKind.class)
    void createsEveryKind(AgentKind kind) {
        TradingAgent agent = factory.create(AgentDefinition.of("agent-" + kind, kind));

        assertEquals("agent-" + kind, agent.agentId());
        assertEquals(kind, agent.kind());
        assertEquals(kind.category(), agent.category());
        assertEquals(kind.defaultSignificance(), agent.significance(), 1e-12);
        StepVerifier.create(agent.healthCheck()).expectNext(true).verifyComplete();
    }

    @Test
    void definitionOverridesDefaults() {
        AgentDefinition def = new AgentDefinition("strat", AgentKind.STRATEGY, 1.5, 0.3,
                                                  EnumSet.of(AgentCategory.RISK), Map.of());
        TradingAgent agent = factory.create(def);

        assertEquals(0.3, agent.significance(), 1e-12);
        assertEquals(EnumSet.of(AgentCategory.RISK), agent.interests());
    }

    @Test
    void executionKindsSubscribeToNothing() {
        assertTrue(factory.create(AgentDefinition.of("ibkr", AgentKind.IBKR_EXECUTION)).interests().isEmpty());
        assertTrue(factory.create(AgentDefinition.of("kalshi", AgentKind.KALSHI_EXECUTION)).interests().isEmpty());
    }

    @Test
    void nonNumericParameterIsRejected() {
        AgentDefinition def = new AgentDefinition("sig", AgentKind.SIGNAL_GENERATOR, 1.0, null, null,
                                                  Map.of("rsi-period", "fourteen"));
        assertThrows(IllegalArgumentException.class, () -> factory.create(def));
    }

    @Test
    void relayForwardsOnceBound() {
        AtomicReference<String> seen = new AtomicReference<>();
        StepVerifier.create(relay.onOutcome("d0", OutcomeLabel.SUCCESS, 1.0)).verifyComplete();
        assertFalse(relay.isBound());

        relay.bind((id, label, pnl) -> Mono.fromRunnable(() -> seen.set(id + ":" + label)));
        relay.onOutcome("d1", OutcomeLabel.FAILURE, -1.0).block();

        assertEquals("d1:FAILURE", seen.get());
    }

    @Test
    void fleetRejectsDuplicateIds() {
        AgentFleet fleet = new AgentFleet();
        fleet.register(factory.create(AgentDefinition.of("a", AgentKind.STRATEGY)));
        fleet.register(factory.create(AgentDefinition.of("b", AgentKind.RULE_SET)));

        assertThrows(IllegalArgumentException.class,
                     () -> fleet.register(factory.create(AgentDefinition.of("a", AgentKind.TOOL_CONTROL))));
        assertEquals(2, fleet.size());
        assertEquals("a", fleet.all().get(0).agentId());
        assertTrue(fleet.find("b").isPresent());
        assertEquals(1, fleet.subscribersOf(AgentCategory.RULE_VALIDATION, "b").size());
    }
}
