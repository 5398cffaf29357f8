package com.cartsafety.common.exception;

/**
 * Logically impossible data: cumulative counts that decrease, contingency cells that
 * go negative, duplicate identifiers. Raised during validation so the value never
 * reaches a published estimate.
 */
public class DataInconsistencyException extends SafetyEngineException {

    public DataInconsistencyException(String component, String message) {
        super(component, message);
    }
}
