package com.carecore.engine.clock;

/**
 * The run could not be set up (census admission or unit start failed). Fatal for the run.
 */
public class SetupFailureException extends RuntimeException {

    public SetupFailureException(String message) {
        super(message);
    }

    public SetupFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
