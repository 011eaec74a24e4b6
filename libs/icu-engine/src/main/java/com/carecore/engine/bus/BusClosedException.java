package com.carecore.engine.bus;

/**
 * Thrown when publishing to, or subscribing on, a bus that has been closed.
 */
public class BusClosedException extends RuntimeException {

    public BusClosedException(String message) {
        super(message);
    }
}
