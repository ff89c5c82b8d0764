package com.trademind.common.model;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

/**
 * Closed set of agent roles. Each role carries its category, a default significance used
 * by importance scoring, and the event categories it subscribes to.
 *
 * <p>Execution roles subscribe to nothing through fan-out: approved decisions reach them
 * directly from the coordinator.
 */
public enum AgentKind {
    // ── signal generation ────────────────────────────────────────────────────
    STRATEGY(AgentCategory.SIGNAL_GENERATION, 0.8,
        EnumSet.of(AgentCategory.TIMING, AgentCategory.RULE_VALIDATION, AgentCategory.COORDINATION)),
    SIGNAL_GENERATOR(AgentCategory.SIGNAL_GENERATION, 0.7,
        EnumSet.of(AgentCategory.SIGNAL_GENERATION, AgentCategory.TIMING)),
    PENNY_STOCK_SCANNER(AgentCategory.SIGNAL_GENERATION, 0.5,
        EnumSet.of(AgentCategory.SERVICE_DATA)),
    RECURSIVE_SCANNER(AgentCategory.SIGNAL_GENERATION, 0.5,
        EnumSet.of(AgentCategory.SERVICE_DATA, AgentCategory.SIGNAL_GENERATION)),

    // ── timing ───────────────────────────────────────────────────────────────
    MARKET_TIMING(AgentCategory.TIMING, 0.6,
        EnumSet.of(AgentCategory.SIGNAL_GENERATION, AgentCategory.SERVICE_DATA)),

    // ── rule validation ──────────────────────────────────────────────────────
    RULE_SET(AgentCategory.RULE_VALIDATION, 0.6,
        EnumSet.of(AgentCategory.SIGNAL_GENERATION, AgentCategory.TIMING)),
    TAX_ESTIMATOR(AgentCategory.RULE_VALIDATION, 0.3,
        EnumSet.of(AgentCategory.EXECUTION, AgentCategory.COORDINATION)),

    // ── risk ─────────────────────────────────────────────────────────────────
    PORTFOLIO_RISK(AgentCategory.RISK, 0.9,
        EnumSet.of(AgentCategory.EXECUTION, AgentCategory.SIGNAL_GENERATION, AgentCategory.COORDINATION)),
    DRAWDOWN_GUARD(AgentCategory.RISK, 0.9,
        EnumSet.of(AgentCategory.EXECUTION, AgentCategory.COORDINATION)),

    // ── execution ────────────────────────────────────────────────────────────
    IBKR_EXECUTION(AgentCategory.EXECUTION, 0.7, EnumSet.noneOf(AgentCategory.class)),
    KALSHI_EXECUTION(AgentCategory.EXECUTION, 0.6, EnumSet.noneOf(AgentCategory.class)),

    // ── memory / learning ────────────────────────────────────────────────────
    MEMORY_LEARNER(AgentCategory.MEMORY_LEARNING, 0.7,
        EnumSet.of(AgentCategory.COORDINATION, AgentCategory.SIGNAL_GENERATION)),

    // ── service / data ───────────────────────────────────────────────────────
    MARKET_DATA(AgentCategory.SERVICE_DATA, 0.4, EnumSet.noneOf(AgentCategory.class)),

    // ── coordination ─────────────────────────────────────────────────────────
    RUNTIME_MONITOR(AgentCategory.COORDINATION, 0.3,
        EnumSet.of(AgentCategory.COORDINATION, AgentCategory.EXECUTION)),
    TOOL_CONTROL(AgentCategory.COORDINATION, 0.2,
        EnumSet.of(AgentCategory.COORDINATION));

    private final AgentCategory category;
    private final double defaultSignificance;
    private final Set<AgentCategory> defaultInterests;

    AgentKind(AgentCategory category, double defaultSignificance, Set<AgentCategory> defaultInterests) {
        this.category = category;
        this.defaultSignificance = defaultSignificance;
        this.defaultInterests = defaultInterests;
    }

    public AgentCategory category() {
        return category;
    }

    public double defaultSignificance() {
        return defaultSignificance;
    }

    /** Returns a fresh copy; callers may narrow it. */
    public Set<AgentCategory> defaultInterests() {
        return defaultInterests.isEmpty()
            ? EnumSet.noneOf(AgentCategory.class)
            : EnumSet.copyOf(defaultInterests);
    }

    public boolean isRisk() {
        return category == AgentCategory.RISK;
    }

    public boolean isExecution() {
        return category == AgentCategory.EXECUTION;
    }

    /**
     * Lenient lookup accepting {@code portfolio-risk}, {@code Portfolio_Risk} and
     * {@code PORTFOLIO_RISK}. Returns {@code null} for unknown names.
     */
    public static AgentKind fromName(String name) {
        if (name == null || name.isBlank()) return null;
        String normalized = name.trim().replace('-', '_').toUpperCase(Locale.ROOT);
        for (AgentKind kind : values()) {
            if (kind.name().equals(normalized)) return kind;
        }
        return null;
    }
}
