package com.trademind.orchestrator.config;

import com.trademind.analysis.agent.AgentDefinition;
import com.trademind.common.exception.ConfigurationException;
import com.trademind.common.model.AgentCategory;
import com.trademind.common.model.AgentKind;
import com.trademind.common.model.CoordinationMode;
import com.trademind.orchestrator.pipeline.RiskLimits;
import com.trademind.orchestrator.pipeline.WeightAdjuster;

import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Turns {@link CoordinatorProperties} into {@link CoordinatorSettings}, failing with a
 * {@link ConfigurationException} that names the offending key. Stateless.
 */
public final class AgentRegistryLoader {

    private static final String PREFIX = "trademind.coordinator.";

    private AgentRegistryLoader() {}

    public static CoordinatorSettings load(CoordinatorProperties props) {
        List<AgentDefinition> agents = loadAgents(props.getAgents());
        List<String> watchlist = loadWatchlist(props.getWatchlist());
        CoordinationMode mode = parseMode(props.getMode());
        double ceiling = unit(props.getDegradedConsensusCeiling(), "degraded-consensus-ceiling");
        if (ceiling < mode.consensusThreshold()) {
            throw new ConfigurationException(String.format(Locale.ROOT,
                "%sdegraded-consensus-ceiling: %.2f is below the %s consensus threshold %.2f, "
                    + "a degraded core could never approve", PREFIX, ceiling, mode, mode.consensusThreshold()));
        }

        return new CoordinatorSettings(
            agents,
            watchlist,
            mode,
            positive(props.getTickDeadline(), "tick-deadline"),
            positive(props.getAgentTimeout(), "agent-timeout"),
            positive(props.getHealthTimeout(), "health-timeout"),
            positive(props.getOutcomeTimeout(), "outcome-timeout"),
            unit(props.getMinActiveFraction(), "min-active-fraction"),
            ceiling,
            riskLimits(props.getRisk()),
            weightAdjuster(props.getWeights()));
    }

    // ── agents ───────────────────────────────────────────────────────────────

    static List<AgentDefinition> loadAgents(List<CoordinatorProperties.AgentEntry> entries) {
        if (entries == null || entries.isEmpty()) {
            throw new ConfigurationException(PREFIX + "agents: at least one agent must be registered");
        }
        Set<String> ids = new HashSet<>();
        List<AgentDefinition> definitions = new ArrayList<>();
        for (int i = 0; i < entries.size(); i++) {
            CoordinatorProperties.AgentEntry entry = entries.get(i);
            String key = PREFIX + "agents[" + i + "]";
            if (entry == null || entry.getId() == null || entry.getId().isBlank()) {
                throw new ConfigurationException(key + ".id: must not be blank");
            }
            String id = entry.getId().trim();
            if (!ids.add(id)) {
                throw new ConfigurationException(key + ".id: duplicate agent id " + id);
            }
            AgentKind kind = AgentKind.fromName(entry.getKind());
            if (kind == null) {
                throw new ConfigurationException(key + ".kind: unknown agent kind '" + entry.getKind() + "'");
            }
            if (!(entry.getWeight() > 0.0) || entry.getWeight() > 2.0) {
                throw new ConfigurationException(key + ".weight: must be within (0, 2], was " + entry.getWeight());
            }
            Double significance = entry.getSignificance();
            if (significance != null) unit(significance, "agents[" + i + "].significance");
            definitions.add(new AgentDefinition(id, kind, entry.getWeight(), significance,
                                                interests(entry.getInterests(), key), entry.getParams()));
        }
        return definitions;
    }

    private static Set<AgentCategory> interests(List<String> names, String key) {
        if (names == null) return null;
        Set<AgentCategory> out = EnumSet.noneOf(AgentCategory.class);
        for (String name : names) {
            try {
                out.add(AgentCategory.valueOf(name.trim().replace('-', '_').toUpperCase(Locale.ROOT)));
            } catch (IllegalArgumentException | NullPointerException e) {
                throw new ConfigurationException(key + ".interests: unknown category '" + name + "'", e);
            }
        }
        return out;
    }

    // ── scalars ──────────────────────────────────────────────────────────────

    private static List<String> loadWatchlist(List<String> raw) {
        List<String> symbols = raw == null ? List.of() : raw.stream()
            .filter(s -> s != null && !s.isBlank())
            .map(s -> s.trim().toUpperCase(Locale.ROOT))
            .distinct()
            .toList();
        if (symbols.isEmpty()) {
            throw new ConfigurationException(PREFIX + "watchlist: at least one symbol is required");
        }
        return symbols;
    }

    static CoordinationMode parseMode(String raw) {
        try {
            return CoordinationMode.valueOf(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException | NullPointerException e) {
            throw new ConfigurationException(PREFIX + "mode: unknown coordination mode '" + raw + "'", e);
        }
    }

    private static RiskLimits riskLimits(CoordinatorProperties.Risk risk) {
        if (risk.getMaxOpenPositions() <= 0) {
            throw new ConfigurationException(PREFIX + "risk.max-open-positions: must be positive");
        }
        if (!(risk.getMaxDailyLoss() > 0)) {
            throw new ConfigurationException(PREFIX + "risk.max-daily-loss: must be positive");
        }
        return new RiskLimits(risk.getMaxOpenPositions(), risk.getMaxDailyLoss(),
                              unit(risk.getMaxSymbolExposure(), "risk.max-symbol-exposure"));
    }

    private static WeightAdjuster weightAdjuster(CoordinatorProperties.Weights weights) {
        if (!(weights.getStep() > 0) || weights.getStep() > 2.0) {
            throw new ConfigurationException(PREFIX + "weights.step: must be within (0, 2]");
        }
        double fraction = unit(weights.getMaxDecayFraction(), "weights.max-decay-fraction");
        if (fraction >= 1.0) {
            throw new ConfigurationException(PREFIX + "weights.max-decay-fraction: must be below 1");
        }
        return new WeightAdjuster(weights.getStep(), fraction);
    }

    private static Duration positive(Duration d, String name) {
        if (d == null || d.isZero() || d.isNegative()) {
            throw new ConfigurationException(PREFIX + name + ": must be a positive duration");
        }
        return d;
    }

    private static double unit(double v, String name) {
        if (Double.isNaN(v) || v < 0.0 || v > 1.0) {
            throw new ConfigurationException(PREFIX + name + ": must be within [0, 1], was " + v);
        }
        return v;
    }
}
