package com.corvus.core.exception;

/**
 * Thrown when an invalid state transition is attempted.
 */
public class InvalidStateTransitionException extends CorvusException {
    
    public static final String ERROR_CODE = "INVALID_STATE_TRANSITION";
    
    public InvalidStateTransitionException(String entityType, String currentState, String targetState) {
        super(ERROR_CODE, String.format(
            "Cannot transition %s from %s to %s",
            entityType, currentState, targetState
        ));
    }
}
