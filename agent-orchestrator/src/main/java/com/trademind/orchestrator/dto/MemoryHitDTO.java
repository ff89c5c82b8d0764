package com.trademind.orchestrator.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.trademind.common.model.EventKind;
import com.trademind.common.model.MemoryRecord;
import com.trademind.common.model.OutcomeLabel;
import com.trademind.common.model.RankedMemory;

import java.time.Instant;

/** One ranked memory without its embedding. */
public record MemoryHitDTO(
    @JsonProperty("recordId")     String recordId,
    @JsonProperty("summary")      String summary,
    @JsonProperty("agentId")      String agentId,
    @JsonProperty("eventKind")    EventKind eventKind,
    @JsonProperty("symbol")       String symbol,
    @JsonProperty("importance")   double importance,
    @JsonProperty("createdAt")    Instant createdAt,
    @JsonProperty("outcomeLabel") OutcomeLabel outcomeLabel,
    @JsonProperty("similarity")   double similarity,
    @JsonProperty("score")        double score
) {
    public static MemoryHitDTO from(RankedMemory hit) {
        MemoryRecord r = hit.record();
        return new MemoryHitDTO(r.recordId(), r.summary(), r.agentId(), r.eventKind(), r.symbol(),
                                r.importance(), r.createdAt(), r.outcomeLabel(), hit.similarity(), hit.score());
    }
}
