package com.trademind.common.agent;

import com.trademind.common.model.OutcomeLabel;
import reactor.core.publisher.Mono;

/** Receives realised outcomes for previously approved decisions. */
@FunctionalInterface
public interface OutcomeListener {

    OutcomeListener NONE = (decisionId, label, pnl) -> Mono.empty();

    Mono<Void> onOutcome(String decisionId, OutcomeLabel label, double pnl);
}
