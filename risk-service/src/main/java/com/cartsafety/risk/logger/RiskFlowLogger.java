package com.cartsafety.risk.logger;

import com.cartsafety.common.exception.SafetyEngineException;
import com.cartsafety.common.trace.TraceContextUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Signal;

import java.util.function.Consumer;

/**
 * Logs the outcome of each risk operation with the request's trace id.
 *
 * <p>The trace id is read from the Reactor Context carried by the {@link Signal} and
 * bridged to MDC only for the duration of the log call.
 *
 * <pre>
 *     .doOnEach(flowLogger.completed(RiskFlowLogger.ESTIMATE, version))
 *     .doOnEach(flowLogger.failed(RiskFlowLogger.ESTIMATE))
 * </pre>
 */
@Component
public class RiskFlowLogger {

    private static final Logger log = LoggerFactory.getLogger(RiskFlowLogger.class);

    public static final String ESTIMATE          = "ESTIMATE";
    public static final String COMPARE           = "COMPARE";
    public static final String MODELS            = "MODELS";
    public static final String ACCRUAL           = "ACCRUAL";
    public static final String STOPPING_BOUNDARY = "STOPPING_BOUNDARY";
    public static final String PREDICTIVE        = "PREDICTIVE";
    public static final String MITIGATION        = "MITIGATION";
    public static final String CATALOGUE         = "CATALOGUE";

    public <T> Consumer<Signal<T>> completed(String operation, String configVersion) {
        return signal -> {
            if (!signal.isOnNext()) return;
            String traceId = TraceContextUtil.getTraceId(signal.getContextView());
            TraceContextUtil.withMdc(traceId, () ->
                log.info("[RiskFlow] operation={} configVersion={} traceId={}", operation, configVersion, traceId)
            );
        };
    }

    /**
     * Rejected input is logged at WARN without a stack trace; anything else is an
     * internal failure and logged at ERROR with one.
     */
    public <T> Consumer<Signal<T>> failed(String operation) {
        return signal -> {
            if (!signal.isOnError()) return;
            String traceId = TraceContextUtil.getTraceId(signal.getContextView());
            Throwable error = signal.getThrowable();
            TraceContextUtil.withMdc(traceId, () -> {
                if (error instanceof SafetyEngineException rejected) {
                    log.warn("[RiskFlow] operation={} rejected component={} reason={} traceId={}",
                        operation, rejected.getComponent(), rejected.getMessage(), traceId);
                } else {
                    log.error("[RiskFlow] operation={} failed traceId={}", operation, traceId, error);
                }
            });
        };
    }
}
