package com.carecore.simulator.run;

/**
 * A run cannot be started or stopped in the launcher's current state: a run is still active, or
 * there is no active run to stop.
 */
public class RunConflictException extends IllegalStateException {

    private final String runId;

    public RunConflictException(String runId, String message) {
        super(message);
        this.runId = runId;
    }

    /** The run that blocked the request, or null when no run is active. */
    public String getRunId() {
        return runId;
    }
}
