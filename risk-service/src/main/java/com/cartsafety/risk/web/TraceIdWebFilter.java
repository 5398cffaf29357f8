package com.cartsafety.risk.web;

import com.cartsafety.common.trace.TraceContextUtil;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.WebFilter;
import org.springframework.web.server.WebFilterChain;
import reactor.core.publisher.Mono;

/**
 * Resolves the trace id from {@code X-Trace-Id} (or generates one), echoes it on the
 * response and writes it into the Reactor Context and the exchange attributes.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class TraceIdWebFilter implements WebFilter {

    @Override
    public Mono<Void> filter(ServerWebExchange exchange, WebFilterChain chain) {
        String traceId = TraceContextUtil.resolveTraceId(
            exchange.getRequest().getHeaders().getFirst(TraceContextUtil.TRACE_ID_HEADER));
        exchange.getAttributes().put(TraceContextUtil.TRACE_ID_KEY, traceId);
        exchange.getResponse().getHeaders().set(TraceContextUtil.TRACE_ID_HEADER, traceId);
        return chain.filter(exchange)
            .contextWrite(ctx -> ctx.put(TraceContextUtil.TRACE_ID_KEY, traceId));
    }
}
