package com.trademind.common.model;

import java.time.Instant;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;

/**
 * Typed message flowing through the output router: signals, coordination decisions and
 * realised outcomes. {@code summary} is the text that gets embedded.
 *
 * <p>{@code refId} points back at the originating signal or decision id.
 */
public record AgentEvent(
    String eventId,
    String agentId,
    AgentCategory category,
    EventKind kind,
    String refId,
    String symbol,
    String summary,
    double confidence,
    Instant timestamp,
    Map<String, Object> attributes
) {
    public static final String COORDINATOR_ID = "coordinator";

    public AgentEvent {
        attributes = attributes == null ? Map.of() : Map.copyOf(attributes);
        timestamp = timestamp == null ? Instant.now() : timestamp;
    }

    public static AgentEvent fromSignal(Signal signal, AgentCategory category) {
        String summary = String.format(Locale.ROOT,
            "Signal %s %s from %s with confidence %.2f and risk %.2f",
            signal.action(), signal.symbol(), signal.agentId(), signal.confidence(), signal.riskScore());
        return new AgentEvent(UUID.randomUUID().toString(), signal.agentId(), category,
                              EventKind.SIGNAL, signal.signalId(), signal.symbol(), summary,
                              signal.confidence(), signal.timestamp(),
                              Map.of("action", signal.action().name(), "source", signal.source().name()));
    }

    public static AgentEvent decision(CoordinationDecision decision) {
        ProposedAction action = decision.action();
        String target = action.isNoOp()
            ? "no action"
            : String.format(Locale.ROOT, "%s %s size %.3f", action.action(), action.symbol(), action.positionSize());
        String summary = String.format(Locale.ROOT,
            "Coordination decision %s: %s with consensus %.2f from %d signals%s",
            decision.verdict(), target, decision.consensusScore(),
            decision.contributingSignalIds().size(),
            decision.violations().isEmpty() ? "" : " violations " + String.join(", ", decision.violations()));
        Map<String, Object> attrs = new HashMap<>();
        attrs.put("verdict", decision.verdict().name());
        attrs.put("tickId", decision.tickId());
        attrs.put("degraded", decision.degraded());
        if (!action.isNoOp()) {
            attrs.put("action", action.action().name());
            attrs.put("positionSize", action.positionSize());
        }
        return new AgentEvent(UUID.randomUUID().toString(), COORDINATOR_ID, AgentCategory.COORDINATION,
                              EventKind.DECISION, decision.decisionId(), action.symbol(), summary,
                              decision.consensusScore(), decision.timestamp(), attrs);
    }

    public static AgentEvent outcome(CoordinationDecision decision, OutcomeLabel label, double pnl) {
        ProposedAction action = decision.action();
        String summary = String.format(Locale.ROOT,
            "Trade outcome %s for %s %s with pnl %.2f after consensus %.2f",
            label, action.action(), action.symbol() == null ? "n/a" : action.symbol(),
            pnl, decision.consensusScore());
        return new AgentEvent(UUID.randomUUID().toString(), COORDINATOR_ID, AgentCategory.COORDINATION,
                              EventKind.OUTCOME, decision.decisionId(), action.symbol(), summary,
                              decision.consensusScore(), Instant.now(),
                              Map.of("outcome", label.name(), "pnl", pnl));
    }
}
