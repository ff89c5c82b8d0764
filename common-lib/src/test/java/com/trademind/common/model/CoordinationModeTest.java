package com.trademind.common.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class CoordinationModeTest {

    @Test
    @DisplayName("position size grows with consensus and is capped by the mode")
    void positionSizing() {
        assertEquals(0.035, CoordinationMode.BALANCED.positionSize(0.5), 1e-12);
        assertEquals(0.03, CoordinationMode.CONSERVATIVE.positionSize(1.0), 1e-12);
        assertEquals(0.05, CoordinationMode.AUTONOMOUS.positionSize(1.0), 1e-12);
    }

    @Test
    @DisplayName("thresholds loosen from conservative to autonomous")
    void thresholdsOrdered() {
        CoordinationMode[] modes = CoordinationMode.values();
        for (int i = 1; i < modes.length; i++) {
            assertTrue(modes[i].consensusThreshold() < modes[i - 1].consensusThreshold());
            assertTrue(modes[i].maxPositionFraction() > modes[i - 1].maxPositionFraction());
        }
    }

    @Test
    @DisplayName("risk reports merge to the worst value per measure")
    void worstRiskReport() {
        RiskReport a = new RiskReport(3, 100.0, java.util.Map.of("AAPL", 0.04, "MSFT", -0.01));
        RiskReport b = new RiskReport(5, 50.0, java.util.Map.of("AAPL", -0.02, "MSFT", -0.06));

        RiskReport worst = a.worst(b);

        assertEquals(5, worst.openPositions());
        assertEquals(100.0, worst.dailyLoss());
        assertEquals(0.04, worst.exposureFor("AAPL"));
        assertEquals(-0.06, worst.exposureFor("MSFT"));
        assertEquals(0.0, worst.exposureFor("TSLA"));
    }
}
