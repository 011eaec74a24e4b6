package com.carecore.engine.event;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Monotonic sequence owned by one producer; the first value is 1.
 */
public final class ProducerSequence {

    private final AtomicLong last = new AtomicLong();

    public long next() {
        return last.incrementAndGet();
    }

    public long current() {
        return last.get();
    }
}
