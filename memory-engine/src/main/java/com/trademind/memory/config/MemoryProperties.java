package com.trademind.memory.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Bound from {@code trademind.memory.*}. Validated into the immutable settings records
 * consumed by the store and routers in {@link MemoryEngineConfig}.
 */
@Data
@ConfigurationProperties(prefix = "trademind.memory")
public class MemoryProperties {

    /** Embedding dimensionality; every stored vector must match. */
    private int dimension = 384;

    private final Embedding embedding = new Embedding();
    private final Output output = new Output();
    private final Input input = new Input();
    private final Retention retention = new Retention();

    @Data
    public static class Embedding {
        /** Base URL of an OpenAI-compatible embedding service; blank selects feature hashing. */
        private String baseUrl = "";
        private String model = "all-MiniLM-L6-v2";
        private String apiKey = "";
        private Duration timeout = Duration.ofSeconds(2);
    }

    @Data
    public static class Output {
        private double threshold = 0.45;
        private double kindWeight = 0.5;
        private double significanceWeight = 0.2;
        private double noveltyWeight = 0.3;
        /** Significance of events emitted by the coordinator itself. */
        private double coordinatorSignificance = 1.0;
        private Duration deliveryTimeout = Duration.ofSeconds(2);
        private int deliveryRetries = 1;
    }

    @Data
    public static class Input {
        private double similarityWeight = 0.6;
        private double recencyWeight = 0.25;
        private double importanceWeight = 0.15;
        private Duration recencyHalfLife = Duration.ofHours(24);
        private int overFetchFactor = 3;
        private int defaultK = 5;
        private int cacheSize = 100;
    }

    @Data
    public static class Retention {
        private Duration maxAge = Duration.ofDays(30);
        private Duration sweepInterval = Duration.ofHours(24);
    }
}
