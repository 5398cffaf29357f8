package com.cartsafety.common.trace;

import org.slf4j.MDC;
import reactor.core.publisher.Mono;
import reactor.util.context.ContextView;

import java.util.UUID;

/**
 * Carries the request trace id through reactive pipelines.
 *
 * <p>The Reactor Context holds the id. MDC is written only for the duration of a single
 * log statement via {@link #withMdc}, never left on a worker thread.
 *
 * <pre>
 *     return TraceContextUtil.withTraceId(pipeline, traceId);
 *     ...
 *     Mono.deferContextual(ctx -> { String id = TraceContextUtil.getTraceId(ctx); ... })
 * </pre>
 */
public final class TraceContextUtil {

    public static final String TRACE_ID_KEY = "traceId";

    public static final String TRACE_ID_HEADER = "X-Trace-Id";

    private TraceContextUtil() {}

    public static <T> Mono<T> withTraceId(Mono<T> mono, String traceId) {
        return mono.contextWrite(ctx -> ctx.put(TRACE_ID_KEY, traceId));
    }

    /** The trace id in {@code ctx}, or {@code "unknown"}. Never null. */
    public static String getTraceId(ContextView ctx) {
        return ctx.getOrDefault(TRACE_ID_KEY, "unknown");
    }

    /** Header value if usable, otherwise a fresh random id. */
    public static String resolveTraceId(String headerValue) {
        if (headerValue == null || headerValue.isBlank() || headerValue.length() > 128) {
            return UUID.randomUUID().toString();
        }
        return headerValue.trim();
    }

    public static void withMdc(String traceId, Runnable logAction) {
        MDC.put(TRACE_ID_KEY, traceId);
        try {
            logAction.run();
        } finally {
            MDC.remove(TRACE_ID_KEY);
        }
    }
}
