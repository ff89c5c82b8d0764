package com.trademind.orchestrator.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.trademind.analysis.agent.AgentFactory;
import com.trademind.analysis.agent.AgentFleet;
import com.trademind.analysis.agent.OutcomeRelay;
import com.trademind.analysis.market.MarketFeed;
import com.trademind.analysis.market.SimulatedMarketFeed;
import com.trademind.analysis.portfolio.PaperPortfolioBook;
import com.trademind.analysis.service.AgentDispatchService;
import com.trademind.common.agent.MemoryAccess;
import com.trademind.common.consensus.ConsensusEngine;
import com.trademind.common.consensus.WeightedConsensusStrategy;
import com.trademind.orchestrator.logger.CoordinationFlowLogger;
import com.trademind.orchestrator.pipeline.RiskGate;
import com.trademind.orchestrator.service.TickEngine;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Wires the analysis-engine library (agents, market feed, paper book, dispatch) and the
 * coordination pipeline. The memory beans come from {@code MemoryEngineConfig}.
 */
@Configuration
@EnableConfigurationProperties(CoordinatorProperties.class)
public class OrchestratorConfig {

    @Bean
    public CoordinatorSettings coordinatorSettings(CoordinatorProperties props) {
        return AgentRegistryLoader.load(props);
    }

    @Bean
    public ConsensusEngine consensusEngine() {
        return new WeightedConsensusStrategy();
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }

    // ── agents ───────────────────────────────────────────────────────────────

    @Bean
    public AgentFleet agentFleet() {
        return new AgentFleet();
    }

    @Bean
    public MarketFeed marketFeed(CoordinatorProperties props, Clock clock) {
        CoordinatorProperties.Market market = props.getMarket();
        return new SimulatedMarketFeed(clock, market.getSeed(), market.getBarVolatility());
    }

    @Bean
    public PaperPortfolioBook paperPortfolioBook(CoordinatorProperties props) {
        return new PaperPortfolioBook(props.getMarket().getCapital());
    }

    @Bean
    public OutcomeRelay outcomeRelay() {
        return new OutcomeRelay();
    }

    @Bean
    public AgentFactory agentFactory(MemoryAccess memoryAccess, MarketFeed feed, PaperPortfolioBook book,
                                     OutcomeRelay relay, Clock clock) {
        return new AgentFactory(memoryAccess, feed, book, relay, clock);
    }

    @Bean
    public AgentDispatchService agentDispatchService() {
        return new AgentDispatchService();
    }

    // ── pipeline ─────────────────────────────────────────────────────────────

    @Bean
    public RiskGate riskGate(CoordinatorSettings settings) {
        return new RiskGate(settings.riskLimits());
    }

    @Bean
    public TickEngine tickEngine(AgentFleet fleet, AgentDispatchService dispatcher, ConsensusEngine consensusEngine,
                                 RiskGate riskGate, CoordinatorSettings settings,
                                 CoordinationFlowLogger flowLogger, Clock clock) {
        return new TickEngine(fleet, dispatcher, consensusEngine, riskGate, settings, flowLogger, clock);
    }
}
