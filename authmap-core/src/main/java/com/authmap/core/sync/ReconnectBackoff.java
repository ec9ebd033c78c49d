package com.authmap.core.sync;

import java.time.Duration;

/** Exponential reconnect delay. Confined to the sync thread. */
final class ReconnectBackoff {
    private final Duration initial;
    private final Duration max;
    private final double multiplier;
    private Duration current;

    ReconnectBackoff(Duration initial, Duration max, double multiplier) {
        this.initial = initial;
        this.max = max;
        this.multiplier = multiplier;
        this.current = initial;
    }

    /** Returns the delay to wait now and grows the next one. */
    Duration nextDelay() {
        Duration delay = current;
        double grown = Math.max(1.0, current.toNanos()) * multiplier;
        current = grown >= max.toNanos() ? max : Duration.ofNanos((long) grown);
        return delay;
    }

    Duration initialDelay() {
        return initial;
    }

    void reset() {
        current = initial;
    }
}
