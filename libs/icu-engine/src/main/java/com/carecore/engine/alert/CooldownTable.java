package com.carecore.engine.alert;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Last-fired time per dedup key.
 */
public final class CooldownTable {

    private final Map<String, Instant> lastFired = new ConcurrentHashMap<>();
    private final Duration cooldown;

    public CooldownTable(Duration cooldown) {
        this.cooldown = cooldown;
    }

    /**
     * Records a firing and returns true if the key never fired or its cooldown has elapsed at
     * {@code at}; otherwise leaves the table unchanged and returns false.
     */
    public boolean tryFire(String dedupKey, Instant at) {
        Instant previous = lastFired.get(dedupKey);
        if (previous != null && at.isBefore(previous.plus(cooldown))) {
            return false;
        }
        lastFired.put(dedupKey, at);
        return true;
    }

    public int size() {
        return lastFired.size();
    }
}
