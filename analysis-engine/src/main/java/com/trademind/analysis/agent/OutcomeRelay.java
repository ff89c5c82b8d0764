package com.trademind.analysis.agent;

import com.trademind.common.agent.OutcomeListener;
import com.trademind.common.model.OutcomeLabel;
import reactor.core.publisher.Mono;

import java.util.concurrent.atomic.AtomicReference;

/**
 * Late-bound {@link OutcomeListener}. Execution agents are built before the coordinator
 * that consumes their outcomes; the coordinator binds itself here once constructed.
 */
public class OutcomeRelay implements OutcomeListener {

    private final AtomicReference<OutcomeListener> target = new AtomicReference<>(OutcomeListener.NONE);

    public void bind(OutcomeListener listener) {
        target.set(listener == null ? OutcomeListener.NONE : listener);
    }

    public boolean isBound() {
        return target.get() != OutcomeListener.NONE;
    }

    @Override
    public Mono<Void> onOutcome(String decisionId, OutcomeLabel label, double pnl) {
        return Mono.defer(() -> target.get().onOutcome(decisionId, label, pnl));
    }
}
