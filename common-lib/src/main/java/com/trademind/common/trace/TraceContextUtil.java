package com.trademind.common.trace;

import org.slf4j.MDC;
import reactor.core.publisher.Mono;
import reactor.util.context.ContextView;

/**
 * Reactive trace propagation keyed on the tick id.
 *
 * <p>Reactor Context carries the trace id inside pipelines. MDC is only written as a
 * temporary bridge while a log statement runs, never as a persistent ThreadLocal store.
 *
 * <pre>
 *     return TraceContextUtil.withTraceId(tickPipeline, ctx.tickId());
 * </pre>
 */
public final class TraceContextUtil {

    public static final String TRACE_ID_KEY = "traceId";
    public static final String UNKNOWN = "unknown";

    private TraceContextUtil() {}

    /**
     * Stores {@code traceId} in the Reactor Context of {@code mono}. Call at the end of
     * pipeline assembly; {@code contextWrite} propagates upstream.
     */
    public static <T> Mono<T> withTraceId(Mono<T> mono, String traceId) {
        return mono.contextWrite(ctx -> ctx.put(TRACE_ID_KEY, traceId == null ? UNKNOWN : traceId));
    }

    /** Returns the trace id from {@code ctx}, or {@code "unknown"}; never {@code null}. */
    public static String getTraceId(ContextView ctx) {
        return ctx.getOrDefault(TRACE_ID_KEY, UNKNOWN);
    }

    /**
     * Bridges {@code traceId} into MDC for the duration of {@code logAction}, then removes
     * it. Only use inside logging side effects.
     */
    public static void withMdc(String traceId, Runnable logAction) {
        MDC.put(TRACE_ID_KEY, traceId == null ? UNKNOWN : traceId);
        try {
            logAction.run();
        } finally {
            MDC.remove(TRACE_ID_KEY);
        }
    }
}
