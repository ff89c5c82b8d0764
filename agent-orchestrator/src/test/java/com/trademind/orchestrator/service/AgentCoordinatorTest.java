package com.trademind.orchestrator.service;

import com.trademind.analysis.agent.AgentFleet;
import com.trademind.analysis.agent.OutcomeRelay;
import com.trademind.common.exception.ValidationException;
import com.trademind.common.model.AgentKind;
import com.trademind.common.model.CoordinationDecision;
import com.trademind.common.model.CoordinationMode;
import com.trademind.common.model.EventKind;
import com.trademind.common.model.LivenessState;
import com.trademind.common.model.OutcomeLabel;
import com.trademind.common.model.RiskVerdict;
import com.trademind.common.model.TickContext;
import com.trademind.orchestrator.CoordinatorHarness;
import com.trademind.orchestrator.MemoryFixture;
import com.trademind.orchestrator.MutableClock;
import com.trademind.orchestrator.ScriptedAgent;
import com.trademind.orchestrator.dto.CoordinatorSnapshot;
import com.trademind.orchestrator.state.CoordinatorPhase;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class AgentCoordinatorTest {

    private final CoordinatorHarness harness = new CoordinatorHarness();
    private final MutableClock clock = harness.clock;
    private final AgentFleet fleet = harness.fleet;
    private final OutcomeRelay relay = harness.relay;
    private final MemoryFixture memory = harness.memory;
    private AgentCoordinator coordinator;

    @AfterEach
    void tearDown() {
        harness.close();
    }

    private ScriptedAgent add(ScriptedAgent agent) {
        return harness.add(agent);
    }

    private ScriptedAgent approvedScenario() {
        return harness.approvedScenario();
    }

    private AgentCoordinator build(CoordinationMode mode) {
        coordinator = harness.build(mode);
        return coordinator;
    }

    private AgentCoordinator build(CoordinationMode mode, Duration tickDeadline, Duration agentTimeout) {
        coordinator = harness.build(mode, tickDeadline, agentTimeout);
        return coordinator;
    }

    private CoordinationDecision startAndTick() {
        memory.store.initialize().block();
        coordinator.start().block();
        return coordinator.runTick().block(Duration.ofSeconds(5));
    }

    private double weightOf(String agentId) {
        return coordinator.state().agent(agentId).weight();
    }

    // ── lifecycle ────────────────────────────────────────────────────────────

    @Nested
    class Lifecycle {

        @Test
        void healthyAgentsBecomeActiveOnStart() {
            approvedScenario();
            add(ScriptedAgent.silent("sick", AgentKind.RULE_SET)).healthy(false);
            build(CoordinationMode.BALANCED);

            coordinator.start().block();

            assertEquals(CoordinatorPhase.IDLE, coordinator.phase());
            assertEquals(LivenessState.ACTIVE, coordinator.state().agent("a").liveness());
            assertEquals(LivenessState.STARTING, coordinator.state().agent("sick").liveness());
            assertEquals(6, fleet.size());
            assertTrue(relay.isBound());
        }

        @Test
        void tickBeforeStartIsSkipped() {
            approvedScenario();
            build(CoordinationMode.BALANCED);

            StepVerifier.create(coordinator.runTick()).verifyComplete();
        }

        @Test
        void stopMarksEveryAgentStopped() {
            approvedScenario();
            build(CoordinationMode.BALANCED);
            coordinator.start().block();

            coordinator.stop();

            assertEquals(CoordinatorPhase.STOPPED, coordinator.phase());
            assertTrue(coordinator.state().agentList().stream()
                .allMatch(s -> s.liveness() == LivenessState.STOPPED));
            StepVerifier.create(coordinator.runTick()).verifyComplete();
        }
    }

    // ── ticks ────────────────────────────────────────────────────────────────

    @Nested
    class Ticks {

        @Test
        @DisplayName("an approved decision is journalled, pending and handed to the venue")
        void approvedDecisionIsHandedOff() {
            ScriptedAgent venue = approvedScenario();
            build(CoordinationMode.BALANCED);

            CoordinationDecision decision = startAndTick();

            assertNotNull(decision);
            assertEquals(RiskVerdict.APPROVED, decision.verdict());
            assertEquals(0.66, decision.consensusScore(), 1e-9);
            assertEquals(1, coordinator.pendingOutcomes());
            assertEquals(CoordinatorPhase.AWAITING_OUTCOME, coordinator.phase());
            assertEquals(List.of(decision), coordinator.recentDecisions(10));
            assertEquals(1, venue.received().size());
            assertEquals(EventKind.DECISION, venue.received().get(0).kind());
            assertEquals(decision.decisionId(), venue.received().get(0).refId());

            CoordinatorSnapshot snapshot = coordinator.snapshot();
            assertEquals(1, snapshot.tickCount());
            assertEquals(1, snapshot.performance().decisions());
            assertEquals(1, snapshot.performance().approved());
            assertEquals(1, snapshot.pendingOutcomes());
            assertTrue(snapshot.communication().eventsIngested() >= 5);
        }

        @Test
        void deferredDecisionLeavesNothingPending() {
            approvedScenario();
            build(CoordinationMode.CONSERVATIVE);

            CoordinationDecision decision = startAndTick();

            assertEquals(RiskVerdict.DEFERRED, decision.verdict());
            assertEquals(0, coordinator.pendingOutcomes());
            assertEquals(CoordinatorPhase.IDLE, coordinator.phase());
            assertTrue(harness.agent("venue").received().isEmpty());
        }

        @Test
        @DisplayName("a tick over its deadline is abandoned, its context cancelled and state untouched")
        void overrunningTickIsAbandoned() {
            AtomicReference<TickContext> seen = new AtomicReference<>();
            approvedScenario();
            add(new ScriptedAgent("stuck", AgentKind.RULE_SET, ctx -> {
                seen.set(ctx);
                return Mono.never();
            }));
            build(CoordinationMode.BALANCED, Duration.ofMillis(200), Duration.ofSeconds(5));

            CoordinationDecision decision = startAndTick();

            assertNull(decision);
            assertTrue(seen.get().isCancelled());
            assertEquals(0, coordinator.state().tickCount());
            assertTrue(coordinator.recentDecisions(10).isEmpty());
            assertEquals(LivenessState.ACTIVE, coordinator.state().agent("stuck").liveness());
            assertEquals(CoordinatorPhase.IDLE, coordinator.phase());
        }

        @Test
        @DisplayName("slow memory fan-out counts against the deadline: no decision, no hand-off")
        void slowSubscriberAbandonsTheWholeTick() {
            ScriptedAgent venue = approvedScenario();
            ScriptedAgent listener = add(ScriptedAgent.silent("learner", AgentKind.MEMORY_LEARNER))
                .onEvent(event -> Mono.never());
            build(CoordinationMode.BALANCED, Duration.ofMillis(300), Duration.ofMillis(100));

            CoordinationDecision decision = startAndTick();

            assertNull(decision);
            assertFalse(listener.received().isEmpty());
            assertTrue(venue.received().isEmpty());
            assertTrue(coordinator.recentDecisions(10).isEmpty());
            assertEquals(0, coordinator.pendingOutcomes());
            assertEquals(0, coordinator.state().tickCount());
            assertEquals(0, coordinator.snapshot().performance().decisions());
            assertEquals(CoordinatorPhase.IDLE, coordinator.phase());
        }

        @Test
        @DisplayName("stop during a tick is not undone when the tick completes")
        void stopDuringTickWins() {
            approvedScenario();
            AtomicReference<AgentCoordinator> self = new AtomicReference<>();
            add(new ScriptedAgent("stopper", AgentKind.RULE_SET, ctx -> {
                self.get().stop();
                return Mono.empty();
            }));
            self.set(build(CoordinationMode.BALANCED));

            startAndTick();

            assertEquals(CoordinatorPhase.STOPPED, coordinator.phase());
            assertTrue(coordinator.state().agentList().stream()
                .allMatch(s -> s.liveness() == LivenessState.STOPPED));
        }

        @Test
        @DisplayName("a degraded agent is probed at the next tick and polled again once healthy")
        void degradedAgentRecovers() {
            approvedScenario();
            ScriptedAgent flaky = add(new ScriptedAgent("flaky", AgentKind.RULE_SET, ctx -> Mono.never()));
            build(CoordinationMode.BALANCED);

            startAndTick();
            assertEquals(LivenessState.DEGRADED, coordinator.state().agent("flaky").liveness());

            flaky.healthy(false);
            coordinator.runTick().block(Duration.ofSeconds(5));
            assertEquals(1, flaky.polls());

            flaky.healthy(true);
            flaky.script(ctx -> Mono.empty());
            coordinator.runTick().block(Duration.ofSeconds(5));
            assertEquals(2, flaky.polls());
            assertEquals(LivenessState.ACTIVE, coordinator.state().agent("flaky").liveness());
        }
    }

    // ── outcomes ─────────────────────────────────────────────────────────────

    @Nested
    class Outcomes {

        @Test
        void successRaisesSupportingWeightsOnce() {
            approvedScenario();
            build(CoordinationMode.BALANCED);
            CoordinationDecision decision = startAndTick();

            StepVerifier.create(coordinator.reportOutcome(decision.decisionId(), OutcomeLabel.SUCCESS, 250.0))
                .expectNext(true)
                .verifyComplete();
            StepVerifier.create(coordinator.reportOutcome(decision.decisionId(), OutcomeLabel.SUCCESS, 250.0))
                .expectNext(false)
                .verifyComplete();

            assertEquals(1.1, weightOf("a"), 1e-9);
            assertEquals(1.1, weightOf("b"), 1e-9);
            assertEquals(0.6, weightOf("c"), 1e-9);
            assertEquals(1.0, weightOf("risk"), 1e-9);
            assertEquals(0, coordinator.pendingOutcomes());
            assertEquals(CoordinatorPhase.IDLE, coordinator.phase());
            assertEquals(OutcomeLabel.SUCCESS, coordinator.recentDecisions(1).get(0).outcome());
            assertEquals(1, coordinator.snapshot().performance().successes());
            assertEquals(250.0, coordinator.snapshot().performance().totalPnl(), 1e-9);
        }

        @Test
        void failureDecaysWeightsWithinBounds() {
            approvedScenario();
            build(CoordinationMode.BALANCED);
            CoordinationDecision decision = startAndTick();

            coordinator.reportOutcome(decision.decisionId(), OutcomeLabel.FAILURE, -90.0).block();

            assertEquals(0.9, weightOf("a"), 1e-9);
            assertEquals(0.4, weightOf("c"), 1e-9);
            assertEquals(1, coordinator.snapshot().performance().failures());
        }

        @Test
        void unknownDecisionIsIgnored() {
            approvedScenario();
            build(CoordinationMode.BALANCED);
            startAndTick();

            StepVerifier.create(coordinator.reportOutcome("no-such-decision", OutcomeLabel.SUCCESS, 1.0))
                .expectNext(false)
                .verifyComplete();
            assertEquals(1, coordinator.pendingOutcomes());
        }

        @Test
        void pendingLabelIsRejected() {
            approvedScenario();
            build(CoordinationMode.BALANCED);
            CoordinationDecision decision = startAndTick();

            StepVerifier.create(coordinator.reportOutcome(decision.decisionId(), OutcomeLabel.PENDING, 0.0))
                .expectError(ValidationException.class)
                .verify();
            assertEquals(1, coordinator.pendingOutcomes());
        }

        @Test
        void venueReportsThroughTheRelay() {
            approvedScenario();
            build(CoordinationMode.BALANCED);
            CoordinationDecision decision = startAndTick();

            relay.onOutcome(decision.decisionId(), OutcomeLabel.SUCCESS, 10.0).block();

            assertEquals(0, coordinator.pendingOutcomes());
            assertEquals(1.1, weightOf("a"), 1e-9);
        }

        @Test
        @DisplayName("stale pending decisions are labelled NEUTRAL and leave weights alone")
        void staleOutcomesExpire() {
            approvedScenario();
            build(CoordinationMode.BALANCED);
            CoordinationDecision decision = startAndTick();

            StepVerifier.create(coordinator.expireStaleOutcomes()).expectNext(0).verifyComplete();
            clock.advance(Duration.ofMinutes(31));
            StepVerifier.create(coordinator.expireStaleOutcomes()).expectNext(1).verifyComplete();

            assertEquals(0, coordinator.pendingOutcomes());
            assertEquals(OutcomeLabel.NEUTRAL, coordinator.recentDecisions(1).get(0).outcome());
            assertEquals(decision.decisionId(), coordinator.recentDecisions(1).get(0).decisionId());
            assertEquals(1.0, weightOf("a"), 1e-9);
            assertEquals(1, coordinator.snapshot().performance().neutral());
        }

        @Test
        @DisplayName("learning is parked while memory refuses writes and replayed once it recovers")
        void learningIsParkedAndRetried() {
            approvedScenario();
            build(CoordinationMode.BALANCED);
            coordinator.start().block();
            CoordinationDecision decision = coordinator.runTick().block(Duration.ofSeconds(5));

            assertNotNull(decision);
            assertEquals(RiskVerdict.APPROVED, decision.verdict());

            StepVerifier.create(coordinator.reportOutcome(decision.decisionId(), OutcomeLabel.SUCCESS, 40.0))
                .expectNext(true)
                .verifyComplete();
            assertEquals(1, coordinator.learningBacklog());
            assertEquals(1.0, weightOf("a"), 1e-9);
            assertEquals(0, coordinator.pendingOutcomes());

            memory.store.initialize().block();
            StepVerifier.create(coordinator.retryDeferredLearning()).expectNext(1).verifyComplete();

            assertEquals(0, coordinator.learningBacklog());
            assertEquals(1.1, weightOf("a"), 1e-9);
            StepVerifier.create(coordinator.retryDeferredLearning()).expectNext(0).verifyComplete();
        }
    }

    @Test
    void modeChangeAppliesToNextTick() {
        approvedScenario();
        build(CoordinationMode.BALANCED);
        memory.store.initialize().block();
        coordinator.start().block();

        coordinator.updateMode(CoordinationMode.CONSERVATIVE);
        CoordinationDecision decision = coordinator.runTick().block(Duration.ofSeconds(5));

        assertEquals(RiskVerdict.DEFERRED, decision.verdict());
        assertEquals(CoordinationMode.CONSERVATIVE, coordinator.snapshot().mode());
    }
}
