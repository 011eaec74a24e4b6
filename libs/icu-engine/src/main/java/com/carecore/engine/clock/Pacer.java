package com.carecore.engine.clock;

import java.time.Duration;
import java.time.Instant;

/**
 * Time source and sleeper used to pace ticks. Replaced by a virtual pacer in tests so that long
 * simulated runs finish immediately.
 */
public interface Pacer {

    Instant now();

    void sleep(Duration duration) throws InterruptedException;

    /** Wall-clock pacing. */
    static Pacer system() {
        return new Pacer() {
            @Override
            public Instant now() {
                return Instant.now();
            }

            @Override
            public void sleep(Duration duration) throws InterruptedException {
                if (!duration.isNegative() && !duration.isZero()) {
                    Thread.sleep(duration.toMillis(), duration.toNanosPart() % 1_000_000);
                }
            }
        };
    }
}
