package com.cartsafety.common.exception;

/**
 * Rejected input: non-positive prior parameters, events greater than n, correlation
 * coefficients outside [0, 1], unknown identifiers. Never corrected silently.
 */
public class InputValidationException extends SafetyEngineException {

    public InputValidationException(String component, String message) {
        super(component, message);
    }

    public static void require(boolean condition, String component, String message) {
        if (!condition) {
            throw new InputValidationException(component, message);
        }
    }
}
