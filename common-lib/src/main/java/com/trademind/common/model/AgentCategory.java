package com.trademind.common.model;

/**
 * Functional grouping of agent roles. Events are tagged with the category of the agent
 * that emitted them; fan-out matches that category against subscriber interests.
 */
public enum AgentCategory {
    SIGNAL_GENERATION,
    TIMING,
    RULE_VALIDATION,
    RISK,
    EXECUTION,
    MEMORY_LEARNING,
    SERVICE_DATA,
    COORDINATION
}
