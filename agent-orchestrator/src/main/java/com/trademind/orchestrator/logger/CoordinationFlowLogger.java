package com.trademind.orchestrator.logger;

import com.trademind.common.model.CoordinationDecision;
import com.trademind.common.model.OutcomeLabel;
import com.trademind.common.trace.TraceContextUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Signal;

import java.util.function.Consumer;

/**
 * Structured log events for the coordination lifecycle. Pure side effects; the tick id
 * is the trace id and is bridged into MDC only while a line is written.
 *
 * <p>Stages (in order):
 * <ol>
 *   <li>{@link #TICK_STARTED}</li>
 *   <li>{@link #AGENTS_POLLED}</li>
 *   <li>{@link #CONSENSUS_SCORED}</li>
 *   <li>{@link #RISK_GATED}</li>
 *   <li>{@link #DECISION_MADE}</li>
 *   <li>{@link #TICK_COMPLETED} or {@link #TICK_ABANDONED}</li>
 * </ol>
 *
 * <pre>
 *     .doOnEach(flowLogger.stage(CoordinationFlowLogger.AGENTS_POLLED))
 * </pre>
 */
@Component
public class CoordinationFlowLogger {

    private static final Logger log = LoggerFactory.getLogger(CoordinationFlowLogger.class);

    public static final String TICK_STARTED     = "TICK_STARTED";
    public static final String AGENTS_POLLED    = "AGENTS_POLLED";
    public static final String CONSENSUS_SCORED = "CONSENSUS_SCORED";
    public static final String RISK_GATED       = "RISK_GATED";
    public static final String DECISION_MADE    = "DECISION_MADE";
    public static final String TICK_COMPLETED   = "TICK_COMPLETED";
    public static final String TICK_ABANDONED   = "TICK_ABANDONED";

    /** {@code doOnEach} consumer reading the tick id from the Reactor Context. Fires on onNext only. */
    public <T> Consumer<Signal<T>> stage(String stageName) {
        return signal -> {
            if (!signal.isOnNext()) return;
            String tickId = TraceContextUtil.getTraceId(signal.getContextView());
            TraceContextUtil.withMdc(tickId, () ->
                log.info("[CoordinationFlow] stage={} tickId={}", stageName, tickId));
        };
    }

    public void logStage(String stageName, String tickId) {
        TraceContextUtil.withMdc(tickId, () ->
            log.info("[CoordinationFlow] stage={} tickId={}", stageName, tickId));
    }

    public void tickAbandoned(String tickId, String reason) {
        TraceContextUtil.withMdc(tickId, () ->
            log.warn("[CoordinationFlow] stage={} tickId={} reason={}", TICK_ABANDONED, tickId, reason));
    }

    public void decision(CoordinationDecision d) {
        TraceContextUtil.withMdc(d.tickId(), () ->
            log.info("[CoordinationFlow] stage={} tickId={} decisionId={} verdict={} action={} symbol={} size={} consensus={} signals={} degraded={} violations={}",
                     DECISION_MADE, d.tickId(), d.decisionId(), d.verdict(), d.action().action(),
                     d.action().symbol(), d.action().positionSize(), String.format("%.3f", d.consensusScore()),
                     d.contributingSignalIds().size(), d.degraded(), d.violations()));
    }

    public void weightChanged(String decisionId, String agentId, double before, double after, OutcomeLabel label) {
        log.info("[CoordinationFlow] Weight changed. decisionId={} agentId={} outcome={} before={} after={}",
                 decisionId, agentId, label, String.format("%.3f", before), String.format("%.3f", after));
    }

    public void degradedTransition(String tickId, boolean degraded, double activeFraction) {
        TraceContextUtil.withMdc(tickId, () -> {
            if (degraded) {
                log.warn("[CoordinationFlow] Entering degraded mode. tickId={} activeFraction={}",
                         tickId, String.format("%.2f", activeFraction));
            } else {
                log.info("[CoordinationFlow] Leaving degraded mode. tickId={} activeFraction={}",
                         tickId, String.format("%.2f", activeFraction));
            }
        });
    }
}
