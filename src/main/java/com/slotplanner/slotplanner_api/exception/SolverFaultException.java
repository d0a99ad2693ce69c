package com.slotplanner.slotplanner_api.exception;

/**
 * Internal solver fault: a search produced an assignment that breaks a hard rule, or a search
 * worker died. Never recoverable by the caller.
 */
public class SolverFaultException extends RuntimeException {

    public SolverFaultException(String message) {
        super(message);
    }

    public SolverFaultException(String message, Throwable cause) {
        super(message, cause);
    }
}
