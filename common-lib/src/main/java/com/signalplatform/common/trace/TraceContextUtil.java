package com.signalplatform.common.trace;

import org.slf4j.MDC;
import reactor.core.publisher.Mono;
import reactor.util.context.ContextView;

/**
 * Carries the refresh cycle id through reactive pipelines.
 *
 * <p>Reactor Context is the single source of truth for the cycle id inside a pipeline.
 * MDC is only written as a temporary bridge around a log statement, never left populated on a
 * pooled thread.
 *
 * <pre>
 *     return TraceContextUtil.withCycleId(pipeline, cycleId);
 *     ...
 *     signal -> TraceContextUtil.getCycleId(signal.getContextView())
 * </pre>
 */
public final class TraceContextUtil {

    public static final String CYCLE_ID_KEY = "cycleId";

    private TraceContextUtil() {}

    /**
     * Stores {@code cycleId} in the Reactor Context of {@code mono}. {@code contextWrite}
     * propagates upstream during subscription, so call this last when assembling the pipeline.
     */
    public static <T> Mono<T> withCycleId(Mono<T> mono, String cycleId) {
        return mono.contextWrite(ctx -> ctx.put(CYCLE_ID_KEY, cycleId));
    }

    /** Returns the cycle id, or {@code "unknown"} when none was written. Never {@code null}. */
    public static String getCycleId(ContextView ctx) {
        return ctx.getOrDefault(CYCLE_ID_KEY, "unknown");
    }

    /**
     * Bridges {@code cycleId} into MDC for the duration of {@code logAction} only.
     */
    public static void withMdc(String cycleId, Runnable logAction) {
        MDC.put(CYCLE_ID_KEY, cycleId);
        try {
            logAction.run();
        } finally {
            MDC.remove(CYCLE_ID_KEY);
        }
    }
}
