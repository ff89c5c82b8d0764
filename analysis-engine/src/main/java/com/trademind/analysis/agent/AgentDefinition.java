package com.trademind.analysis.agent;

import com.trademind.common.model.AgentCategory;
import com.trademind.common.model.AgentKind;

import java.util.Map;
import java.util.Set;

/**
 * Validated registry entry for one agent instance. {@code significance} and
 * {@code interests} fall back to the kind's defaults when {@code null}.
 */
public record AgentDefinition(
    String agentId,
    AgentKind kind,
    double initialWeight,
    Double significance,
    Set<AgentCategory> interests,
    Map<String, String> params
) {
    public AgentDefinition {
        params = params == null ? Map.of() : Map.copyOf(params);
        interests = interests == null ? null : Set.copyOf(interests);
    }

    public static AgentDefinition of(String agentId, AgentKind kind) {
        return new AgentDefinition(agentId, kind, 1.0, null, null, Map.of());
    }

    public double effectiveSignificance() {
        return significance != null ? significance : kind.defaultSignificance();
    }

    public Set<AgentCategory> effectiveInterests() {
        return interests != null ? interests : kind.defaultInterests();
    }

    public double param(String name, double fallback) {
        String raw = params.get(name);
        if (raw == null || raw.isBlank()) return fallback;
        try {
            return Double.parseDouble(raw.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("agent " + agentId + ": parameter " + name
                                               + " is not a number: " + raw, e);
        }
    }

    public String param(String name, String fallback) {
        String raw = params.get(name);
        return raw == null || raw.isBlank() ? fallback : raw.trim();
    }
}
