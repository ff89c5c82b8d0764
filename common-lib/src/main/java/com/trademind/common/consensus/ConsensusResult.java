package com.trademind.common.consensus;

import com.trademind.common.model.TradeAction;

import java.util.List;
import java.util.Map;

/**
 * Immutable output of a {@link ConsensusEngine} run.
 *
 * <ul>
 *   <li>{@code chosen}: winning candidate, or {@code null} when no signals were usable or
 *       the top candidates tied on both consensus and risk</li>
 *   <li>{@code consensusScore}: the highest candidate consensus, in {@code [0, 1]}</li>
 *   <li>{@code consideredSignalIds}: signals left after de-duplication</li>
 *   <li>{@code weightsUsed}: weight applied per contributing agent</li>
 * </ul>
 */
public record ConsensusResult(
    CandidateScore chosen,
    double consensusScore,
    List<CandidateScore> candidates,
    List<String> consideredSignalIds,
    Map<String, Double> weightsUsed
) {
    public ConsensusResult {
        candidates = List.copyOf(candidates);
        consideredSignalIds = List.copyOf(consideredSignalIds);
        weightsUsed = Map.copyOf(weightsUsed);
    }

    public static ConsensusResult empty() {
        return new ConsensusResult(null, 0.0, List.of(), List.of(), Map.of());
    }

    /** True when a BUY or SELL candidate won outright. */
    public boolean hasAction() {
        return chosen != null && chosen.action() != TradeAction.HOLD;
    }

    /** Supporters of the chosen candidate; every considered signal for a no-op. */
    public List<String> contributingSignalIds() {
        return hasAction() ? chosen.supportingSignalIds() : consideredSignalIds;
    }
}
