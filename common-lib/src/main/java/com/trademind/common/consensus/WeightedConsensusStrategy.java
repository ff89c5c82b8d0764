package com.trademind.common.consensus;

import com.trademind.common.model.Signal;
import com.trademind.common.model.TradeAction;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Performance-weighted {@link ConsensusEngine}.
 *
 * <h3>Algorithm</h3>
 * <ol>
 *   <li>De-duplicate: a signal id is counted once, and each agent contributes only its
 *       latest signal (ties broken by the smaller signal id).</li>
 *   <li>Order the survivors by (symbol, agent id) so every sum below runs in the same
 *       order regardless of input order.</li>
 *   <li>For each (symbol, action):
 *       <pre>
 *   consensus = Σ(confidence × weight of supporters) / Σ(weight of all signals on symbol)
 *   risk      = Σ(riskScore × weight of supporters) / Σ(weight of supporters)
 *       </pre></li>
 *   <li>Highest consensus wins. A tie (within {@value #EPSILON}) goes to the lower
 *       weighted risk; a tie on both yields no action.</li>
 * </ol>
 *
 * <p>A HOLD candidate can win; the result then carries no action. Stateless and
 * thread-safe.
 */
public class WeightedConsensusStrategy implements ConsensusEngine {

    static final double EPSILON = 1e-9;
    private static final double DEFAULT_WEIGHT = 1.0;

    /** Agent, then newest first, then smaller signal id. */
    private static final Comparator<Signal> SELECTION_ORDER = Comparator
        .comparing(Signal::agentId)
        .thenComparing(Signal::timestamp, Comparator.reverseOrder())
        .thenComparing(Signal::signalId);

    private static final Comparator<Signal> SUMMATION_ORDER = Comparator
        .comparing(Signal::symbol)
        .thenComparing(Signal::agentId);

    @Override
    public ConsensusResult compute(Collection<Signal> signals, Map<String, Double> weights) {
        if (signals == null || signals.isEmpty()) {
            return ConsensusResult.empty();
        }
        Map<String, Double> weightMap = weights == null ? Map.of() : weights;

        List<Signal> considered = deduplicate(signals);
        if (considered.isEmpty()) {
            return ConsensusResult.empty();
        }

        Map<String, Double> weightsUsed = new HashMap<>();
        for (Signal s : considered) {
            weightsUsed.put(s.agentId(), weightOf(s.agentId(), weightMap));
        }

        List<CandidateScore> candidates = scoreCandidates(considered, weightsUsed);
        CandidateScore chosen = choose(candidates);
        double best = candidates.stream().mapToDouble(CandidateScore::consensus).max().orElse(0.0);

        List<String> consideredIds = considered.stream().map(Signal::signalId).toList();
        return new ConsensusResult(chosen, clampUnit(best), candidates, consideredIds, weightsUsed);
    }

    // ── de-duplication ───────────────────────────────────────────────────────

    private List<Signal> deduplicate(Collection<Signal> signals) {
        List<Signal> ordered = new ArrayList<>();
        for (Signal s : signals) {
            if (s != null) ordered.add(s);
        }
        ordered.sort(SELECTION_ORDER);

        Set<String> seenSignals = new HashSet<>();
        Set<String> seenAgents = new HashSet<>();
        List<Signal> kept = new ArrayList<>();
        for (Signal s : ordered) {
            if (!seenSignals.add(s.signalId())) continue;
            if (!seenAgents.add(s.agentId())) continue;
            kept.add(s);
        }
        kept.sort(SUMMATION_ORDER);
        return kept;
    }

    // ── scoring ──────────────────────────────────────────────────────────────

    private List<CandidateScore> scoreCandidates(List<Signal> considered, Map<String, Double> weights) {
        Map<String, List<Signal>> bySymbol = new TreeMap<>();
        for (Signal s : considered) {
            bySymbol.computeIfAbsent(s.symbol(), k -> new ArrayList<>()).add(s);
        }

        List<CandidateScore> candidates = new ArrayList<>();
        for (Map.Entry<String, List<Signal>> entry : bySymbol.entrySet()) {
            List<Signal> onSymbol = entry.getValue();
            double symbolWeight = 0.0;
            for (Signal s : onSymbol) {
                symbolWeight += weights.get(s.agentId());
            }
            for (TradeAction action : TradeAction.values()) {
                double support = 0.0;
                double riskSum = 0.0;
                double supporterWeight = 0.0;
                double rawRisk = 0.0;
                List<String> supporters = new ArrayList<>();
                for (Signal s : onSymbol) {
                    if (s.action() != action) continue;
                    double w = weights.get(s.agentId());
                    support += s.confidence() * w;
                    riskSum += s.riskScore() * w;
                    supporterWeight += w;
                    rawRisk += s.riskScore();
                    supporters.add(s.signalId());
                }
                if (supporters.isEmpty()) continue;
                double consensus = symbolWeight > 0.0 ? clampUnit(support / symbolWeight) : 0.0;
                double risk = supporterWeight > 0.0 ? riskSum / supporterWeight : rawRisk / supporters.size();
                candidates.add(new CandidateScore(entry.getKey(), action, consensus, risk, supporters));
            }
        }
        return candidates;
    }

    private CandidateScore choose(List<CandidateScore> candidates) {
        if (candidates.isEmpty()) return null;
        double best = candidates.stream().mapToDouble(CandidateScore::consensus).max().orElse(0.0);
        List<CandidateScore> top = candidates.stream()
            .filter(c -> best - c.consensus() <= EPSILON)
            .toList();
        if (top.size() == 1) return top.get(0);

        double lowestRisk = top.stream().mapToDouble(CandidateScore::weightedRisk).min().orElse(0.0);
        List<CandidateScore> safest = top.stream()
            .filter(c -> c.weightedRisk() - lowestRisk <= EPSILON)
            .toList();
        return safest.size() == 1 ? safest.get(0) : null;
    }

    private static double weightOf(String agentId, Map<String, Double> weights) {
        Double w = weights.get(agentId);
        if (w == null || w.isNaN()) return DEFAULT_WEIGHT;
        return Math.max(0.0, w);
    }

    private static double clampUnit(double v) {
        return Math.max(0.0, Math.min(1.0, v));
    }
}
