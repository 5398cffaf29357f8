package com.cartsafety.common.exception;

/**
 * Base type for every failure raised by the statistical core.
 *
 * <p>The component name identifies which engine rejected the input
 * (e.g. {@code EvidenceEngine}, {@code ModelRegistry}) and is prefixed to the message.
 */
public class SafetyEngineException extends RuntimeException {

    private final String component;

    public SafetyEngineException(String component, String message) {
        super("[" + component + "] " + message);
        this.component = component;
    }

    public SafetyEngineException(String component, String message, Throwable cause) {
        super("[" + component + "] " + message, cause);
        this.component = component;
    }

    public String getComponent() {
        return component;
    }
}
