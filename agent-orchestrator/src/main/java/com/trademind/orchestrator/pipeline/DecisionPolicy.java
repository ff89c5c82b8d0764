package com.trademind.orchestrator.pipeline;

import com.trademind.common.model.ProposedAction;
import com.trademind.common.model.RiskVerdict;

/**
 * Final verdict, first match wins:
 * <ol>
 *   <li>any risk violation → REJECTED</li>
 *   <li>risk agents silent → DEFERRED</li>
 *   <li>no-op, or consensus below the mode threshold → DEFERRED</li>
 *   <li>otherwise → APPROVED</li>
 * </ol>
 */
public final class DecisionPolicy {

    private DecisionPolicy() {}

    public static RiskVerdict decide(double consensus, double threshold, ProposedAction action, RiskAssessment risk) {
        if (risk.hasViolations()) return RiskVerdict.REJECTED;
        if (risk.missingRisk()) return RiskVerdict.DEFERRED;
        if (action.isNoOp() || consensus < threshold) return RiskVerdict.DEFERRED;
        return RiskVerdict.APPROVED;
    }
}
