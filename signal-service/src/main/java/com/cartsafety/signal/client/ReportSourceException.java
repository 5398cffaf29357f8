package com.cartsafety.signal.client;

import com.cartsafety.common.exception.SafetyEngineException;

/** The reporting database could not answer a count query. Retried within the request budget. */
public class ReportSourceException extends SafetyEngineException {

    public ReportSourceException(String message) {
        super("ReportSource", message);
    }

    public ReportSourceException(String message, Throwable cause) {
        super("ReportSource", message, cause);
    }
}
