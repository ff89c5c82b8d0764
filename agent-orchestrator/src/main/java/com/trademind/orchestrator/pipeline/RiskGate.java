package com.trademind.orchestrator.pipeline;

import com.trademind.common.model.ProposedAction;
import com.trademind.common.model.RiskReport;
import com.trademind.common.model.Signal;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;

/**
 * Checks a proposed action against the configured {@link RiskLimits} using the worst
 * values reported by risk-role agents this tick.
 *
 * <h3>Rules</h3>
 * <ul>
 *   <li>open positions ≥ max  → violation (the action would open another)</li>
 *   <li>daily loss ≥ max      → violation</li>
 *   <li>|exposure + size| &gt; cap on the action's symbol → violation</li>
 * </ul>
 *
 * <p>A no-op is never gated. Stateless.
 */
public class RiskGate {

    private final RiskLimits limits;

    public RiskGate(RiskLimits limits) {
        this.limits = limits;
    }

    public RiskLimits limits() {
        return limits;
    }

    /**
     * @param action               proposal from the scoring stage
     * @param riskSignals          this tick's signals from risk-role agents
     * @param riskAgentsRegistered whether the fleet contains any risk-role agent
     */
    public RiskAssessment evaluate(ProposedAction action, Collection<Signal> riskSignals, boolean riskAgentsRegistered) {
        RiskReport merged = null;
        for (Signal signal : riskSignals) {
            if (signal.hasRiskReport()) {
                merged = merged == null ? signal.riskReport() : merged.worst(signal.riskReport());
            }
        }
        boolean missing = riskAgentsRegistered && merged == null;
        RiskReport report = merged == null ? RiskReport.empty() : merged;
        if (action.isNoOp()) {
            return new RiskAssessment(List.of(), missing, report);
        }

        List<String> violations = new ArrayList<>();
        if (report.openPositions() >= limits.maxOpenPositions()) {
            violations.add(String.format(Locale.ROOT, "max-open-positions: %d open, limit %d",
                                         report.openPositions(), limits.maxOpenPositions()));
        }
        if (report.dailyLoss() >= limits.maxDailyLoss()) {
            violations.add(String.format(Locale.ROOT, "max-daily-loss: %.2f lost, limit %.2f",
                                         report.dailyLoss(), limits.maxDailyLoss()));
        }
        double projected = report.exposureFor(action.symbol()) + action.signedSize();
        if (Math.abs(projected) > limits.maxSymbolExposure() + 1e-12) {
            violations.add(String.format(Locale.ROOT, "symbol-exposure: %s would reach %.4f, cap %.4f",
                                         action.symbol(), projected, limits.maxSymbolExposure()));
        }
        return new RiskAssessment(violations, missing, report);
    }
}
