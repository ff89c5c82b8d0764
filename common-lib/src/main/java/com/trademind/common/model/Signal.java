package com.trademind.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.trademind.common.exception.ValidationException;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * One agent's recommendation for one symbol. Immutable; scores outside {@code [0, 1]}
 * are rejected at construction.
 *
 * <p>{@code riskReport} is only populated by risk-role agents.
 */
public record Signal(
    @JsonProperty("signalId")   String signalId,
    @JsonProperty("agentId")    String agentId,
    @JsonProperty("timestamp")  Instant timestamp,
    @JsonProperty("symbol")     String symbol,
    @JsonProperty("action")     TradeAction action,
    @JsonProperty("confidence") double confidence,
    @JsonProperty("riskScore")  double riskScore,
    @JsonProperty("payload")    Map<String, Object> payload,
    @JsonProperty("source")     SignalSource source,
    @JsonProperty("riskReport") RiskReport riskReport
) {
    public Signal {
        ValidationException.require(signalId != null && !signalId.isBlank(), "signalId must not be blank");
        ValidationException.require(agentId != null && !agentId.isBlank(), "agentId must not be blank");
        ValidationException.require(symbol != null && !symbol.isBlank(), "symbol must not be blank");
        ValidationException.require(action != null, "action must not be null");
        ValidationException.requireUnitInterval(confidence, "confidence");
        ValidationException.requireUnitInterval(riskScore, "riskScore");
        Objects.requireNonNull(timestamp, "timestamp");
        payload = payload == null ? Map.of() : Map.copyOf(payload);
        source = source == null ? SignalSource.DERIVED : source;
    }

    public static Signal of(String agentId, String symbol, TradeAction action,
                            double confidence, double riskScore,
                            Map<String, Object> payload, SignalSource source) {
        return new Signal(UUID.randomUUID().toString(), agentId, Instant.now(), symbol,
                          action, confidence, riskScore, payload, source, null);
    }

    public Signal withRiskReport(RiskReport report) {
        return new Signal(signalId, agentId, timestamp, symbol, action, confidence,
                          riskScore, payload, source, report);
    }

    public boolean hasRiskReport() {
        return riskReport != null;
    }
}
