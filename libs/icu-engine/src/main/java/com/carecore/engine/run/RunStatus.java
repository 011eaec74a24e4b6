package com.carecore.engine.run;

/** Lifecycle of a simulation run. */
public enum RunStatus {
    IDLE,
    RUNNING,
    COMPLETED,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }
}
