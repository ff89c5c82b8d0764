package com.trademind.orchestrator.pipeline;

import com.trademind.common.model.RiskReport;

import java.util.List;

/**
 * Output of {@link RiskGate#evaluate}.
 *
 * @param violations  human-readable limit breaches; any entry forces REJECTED
 * @param missingRisk risk agents are registered but none reported this tick
 * @param report      worst-case merge of the reports that did arrive
 */
public record RiskAssessment(List<String> violations, boolean missingRisk, RiskReport report) {

    public RiskAssessment {
        violations = List.copyOf(violations);
    }

    public boolean hasViolations() {
        return !violations.isEmpty();
    }
}
