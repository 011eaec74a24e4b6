package com.carecore.engine;

/**
 * A single-threaded engine component driven by its own thread until the bus closes.
 */
public interface EngineUnit extends Runnable {

    /** Thread and log name of the unit, e.g. "agent-nurse". */
    String name();

    /**
     * Work not yet finished: queued events plus the one being handled, if any.
     * Used by the clock's soft barrier and final drain.
     */
    int pending();
}
