package com.cartsafety.signal.logger;

import com.cartsafety.common.exception.SafetyEngineException;
import com.cartsafety.common.trace.TraceContextUtil;
import com.cartsafety.signal.model.SignalResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Signal;

import java.util.function.Consumer;

/**
 * Logs signal-detection outcomes with the request's trace id, read from the Reactor
 * Context and bridged to MDC for the duration of the log call.
 */
@Component
public class SignalFlowLogger {

    private static final Logger log = LoggerFactory.getLogger(SignalFlowLogger.class);

    public static final String DETECT   = "DETECT";
    public static final String PANEL    = "PANEL";
    public static final String EVALUATE = "EVALUATE";

    public Consumer<Signal<SignalResult>> detected() {
        return signal -> {
            if (!signal.isOnNext()) return;
            SignalResult result = signal.get();
            String traceId = TraceContextUtil.getTraceId(signal.getContextView());
            TraceContextUtil.withMdc(traceId, () ->
                log.info("[SignalFlow] drug={} event={} status={} tier={} reason={} traceId={}",
                    result.drug(), result.event(), result.status(), result.tier(),
                    result.unavailableReason(), traceId)
            );
        };
    }

    public <T> Consumer<Signal<T>> completed(String operation, String configVersion) {
        return signal -> {
            if (!signal.isOnNext()) return;
            String traceId = TraceContextUtil.getTraceId(signal.getContextView());
            TraceContextUtil.withMdc(traceId, () ->
                log.info("[SignalFlow] operation={} configVersion={} traceId={}", operation, configVersion, traceId)
            );
        };
    }

    public <T> Consumer<Signal<T>> failed(String operation) {
        return signal -> {
            if (!signal.isOnError()) return;
            String traceId = TraceContextUtil.getTraceId(signal.getContextView());
            Throwable error = signal.getThrowable();
            TraceContextUtil.withMdc(traceId, () -> {
                if (error instanceof SafetyEngineException rejected) {
                    log.warn("[SignalFlow] operation={} rejected component={} reason={} traceId={}",
                        operation, rejected.getComponent(), rejected.getMessage(), traceId);
                } else {
                    log.error("[SignalFlow] operation={} failed traceId={}", operation, traceId, error);
                }
            });
        };
    }
}
