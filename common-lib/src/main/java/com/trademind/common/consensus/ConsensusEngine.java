package com.trademind.common.consensus;

import com.trademind.common.model.Signal;

import java.util.Collection;
import java.util.Map;

/**
 * Strategy contract for turning one tick's signals into a consensus candidate.
 *
 * <p>Implementations must be:
 * <ul>
 *   <li><b>Stateless</b>: safe to call concurrently</li>
 *   <li><b>Pure</b>: no logging, no reactive types, no side effects</li>
 *   <li><b>Order independent</b>: any permutation of the input yields the same result</li>
 *   <li><b>Non-null</b>: an empty or null input yields {@link ConsensusResult#empty()}</li>
 * </ul>
 */
public interface ConsensusEngine {

    /**
     * @param signals signals collected during the tick; may contain duplicates
     * @param weights agent id to weight; agents missing from the map weigh {@code 1.0}
     */
    ConsensusResult compute(Collection<Signal> signals, Map<String, Double> weights);
}
