package com.trademind.memory.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.trademind.common.agent.AgentDirectory;
import com.trademind.common.agent.MemoryAccess;
import com.trademind.memory.embedding.Embedder;
import com.trademind.memory.embedding.HashingEmbedder;
import com.trademind.memory.embedding.RemoteEmbeddingClient;
import com.trademind.memory.embedding.ResilientEmbedder;
import com.trademind.memory.routing.AgentInputRouter;
import com.trademind.memory.routing.AgentOutputRouter;
import com.trademind.memory.routing.DeliveryPolicy;
import com.trademind.memory.routing.ImportancePolicy;
import com.trademind.memory.routing.RankingPolicy;
import com.trademind.memory.routing.RouterMemoryAccess;
import com.trademind.memory.store.R2dbcMetadataTable;
import com.trademind.memory.store.R2dbcVectorIndex;
import com.trademind.memory.store.VectorMemoryStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.r2dbc.core.R2dbcEntityTemplate;
import org.springframework.transaction.ReactiveTransactionManager;
import org.springframework.transaction.reactive.TransactionalOperator;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Clock;

@Configuration
@EnableConfigurationProperties(MemoryProperties.class)
public class MemoryEngineConfig {

    private static final Logger log = LoggerFactory.getLogger(MemoryEngineConfig.class);

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public Embedder embedder(MemoryProperties props, WebClient.Builder builder, ObjectMapper objectMapper) {
        HashingEmbedder hashing = new HashingEmbedder(props.getDimension());
        MemoryProperties.Embedding cfg = props.getEmbedding();
        if (cfg.getBaseUrl() == null || cfg.getBaseUrl().isBlank()) {
            log.info("[MemoryEngine] No embedding backend configured, using feature hashing. dimension={}",
                     props.getDimension());
            return hashing;
        }
        log.info("[MemoryEngine] Embedding backend configured. baseUrl={} model={} dimension={}",
                 cfg.getBaseUrl(), cfg.getModel(), props.getDimension());
        RemoteEmbeddingClient remote = new RemoteEmbeddingClient(builder, objectMapper, cfg.getBaseUrl(),
            cfg.getApiKey(), cfg.getModel(), props.getDimension(), cfg.getTimeout());
        return new ResilientEmbedder(remote, hashing);
    }

    @Bean(destroyMethod = "shutdown")
    public VectorMemoryStore vectorMemoryStore(R2dbcEntityTemplate template, ObjectMapper objectMapper,
                                               ReactiveTransactionManager transactionManager,
                                               MemoryProperties props) {
        return new VectorMemoryStore(
            new R2dbcVectorIndex(template, objectMapper),
            new R2dbcMetadataTable(template),
            TransactionalOperator.create(transactionManager),
            props.getDimension());
    }

    @Bean
    public AgentOutputRouter agentOutputRouter(Embedder embedder, VectorMemoryStore store,
                                               AgentDirectory directory, MemoryProperties props) {
        MemoryProperties.Output out = props.getOutput();
        return new AgentOutputRouter(embedder, store, directory,
            new ImportancePolicy(out.getKindWeight(), out.getSignificanceWeight(), out.getNoveltyWeight(),
                                 out.getThreshold(), out.getCoordinatorSignificance()),
            new DeliveryPolicy(out.getDeliveryTimeout(), out.getDeliveryRetries()));
    }

    @Bean
    public AgentInputRouter agentInputRouter(Embedder embedder, VectorMemoryStore store,
                                             MemoryProperties props, Clock clock) {
        MemoryProperties.Input in = props.getInput();
        return new AgentInputRouter(embedder, store,
            new RankingPolicy(in.getSimilarityWeight(), in.getRecencyWeight(), in.getImportanceWeight(),
                              in.getRecencyHalfLife(), in.getOverFetchFactor(), in.getDefaultK(),
                              in.getCacheSize()),
            clock);
    }

    @Bean
    public MemoryAccess memoryAccess(AgentInputRouter inputRouter, AgentOutputRouter outputRouter) {
        return new RouterMemoryAccess(inputRouter, outputRouter);
    }
}
