package com.trademind.orchestrator.pipeline;

/**
 * Hard limits enforced by {@link RiskGate}.
 *
 * @param maxOpenPositions  positions that may be open at once
 * @param maxDailyLoss      realised loss per UTC day, currency units
 * @param maxSymbolExposure absolute signed exposure cap per symbol, fraction of capital
 */
public record RiskLimits(int maxOpenPositions, double maxDailyLoss, double maxSymbolExposure) {
}
