package com.trademind.orchestrator.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Raw binding of {@code trademind.coordinator.*}. Nothing reads these directly:
 * {@link AgentRegistryLoader} validates them into {@link CoordinatorSettings} at boot.
 */
@Data
@ConfigurationProperties(prefix = "trademind.coordinator")
public class CoordinatorProperties {

    private List<AgentEntry> agents = new ArrayList<>();
    private List<String> watchlist = new ArrayList<>();
    private String mode = "BALANCED";

    private Duration tickInterval = Duration.ofSeconds(30);
    private Duration tickDeadline = Duration.ofSeconds(10);
    private Duration agentTimeout = Duration.ofSeconds(3);
    private Duration healthTimeout = Duration.ofSeconds(1);
    private Duration outcomeTimeout = Duration.ofMinutes(30);
    private Duration backlogRetryInterval = Duration.ofSeconds(30);
    private boolean schedulerEnabled = true;

    /** Below this fraction of ACTIVE agents the coordinator runs degraded. */
    private double minActiveFraction = 0.5;
    private double degradedConsensusCeiling = 0.6;

    private final Risk risk = new Risk();
    private final Weights weights = new Weights();
    private final Market market = new Market();

    @Data
    public static class AgentEntry {
        private String id;
        private String kind;
        private double weight = 1.0;
        /** Overrides the kind's default significance when set. */
        private Double significance;
        /** Overrides the kind's default interests when set. */
        private List<String> interests;
        private Map<String, String> params = new LinkedHashMap<>();
    }

    @Data
    public static class Risk {
        private int maxOpenPositions = 5;
        private double maxDailyLoss = 2000.0;
        /** Absolute per-symbol exposure cap as a fraction of capital. */
        private double maxSymbolExposure = 0.10;
    }

    @Data
    public static class Weights {
        private double step = 0.1;
        private double maxDecayFraction = 0.5;
    }

    @Data
    public static class Market {
        private long seed = 42L;
        private double barVolatility = 0.01;
        private double capital = 100_000.0;
    }
}
