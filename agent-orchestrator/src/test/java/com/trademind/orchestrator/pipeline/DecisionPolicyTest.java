package com.trademind.orchestrator.pipeline;

import com.trademind.common.model.ProposedAction;
import com.trademind.common.model.RiskReport;
import com.trademind.common.model.RiskVerdict;
import com.trademind.common.model.TradeAction;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DecisionPolicyTest {

    private static final ProposedAction BUY = ProposedAction.of("AAPL", TradeAction.BUY, 0.04);
    private static final RiskAssessment CLEAR = new RiskAssessment(List.of(), false, RiskReport.empty());
    private static final RiskAssessment VIOLATED =
        new RiskAssessment(List.of("max-daily-loss: 2500.00 lost, limit 2000.00"), false, RiskReport.empty());

    @ParameterizedTest
    @ValueSource(doubles = {0.0, 0.3, 0.6, 0.99, 1.0})
    void violationRejectsWhateverTheConsensus(double consensus) {
        assertEquals(RiskVerdict.REJECTED, DecisionPolicy.decide(consensus, 0.6, BUY, VIOLATED));
    }

    @Test
    void silentRiskAgentsDefer() {
        RiskAssessment missing = new RiskAssessment(List.of(), true, RiskReport.empty());
        assertEquals(RiskVerdict.DEFERRED, DecisionPolicy.decide(0.95, 0.6, BUY, missing));
    }

    @Test
    void noOpDefers() {
        assertEquals(RiskVerdict.DEFERRED, DecisionPolicy.decide(0.95, 0.6, ProposedAction.NO_OP, CLEAR));
    }

    @Test
    void thresholdIsInclusive() {
        assertEquals(RiskVerdict.DEFERRED, DecisionPolicy.decide(0.5999, 0.6, BUY, CLEAR));
        assertEquals(RiskVerdict.APPROVED, DecisionPolicy.decide(0.6, 0.6, BUY, CLEAR));
    }
}
