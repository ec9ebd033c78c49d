package com.authmap.core.sync;

import java.time.Duration;
import java.util.Objects;

/**
 * Tunables for {@link MappingSyncLoop}.
 *
 * @param resourceName name of the single watched resource
 * @param failFastOnInitialOpen treat a failure of the very first watch-open as fatal
 * @param initialBackoff delay before the first reconnect
 * @param maxBackoff upper bound for the reconnect delay
 * @param backoffMultiplier growth factor applied after each unproductive attempt
 */
public record SyncSettings(
        String resourceName,
        boolean failFastOnInitialOpen,
        Duration initialBackoff,
        Duration maxBackoff,
        double backoffMultiplier) {

    public static final String DEFAULT_RESOURCE_NAME = "aws-auth";

    public SyncSettings {
        Objects.requireNonNull(resourceName, "resourceName");
        if (resourceName.isBlank()) {
            throw new IllegalArgumentException("resourceName must not be blank");
        }
        Objects.requireNonNull(initialBackoff, "initialBackoff");
        Objects.requireNonNull(maxBackoff, "maxBackoff");
        if (initialBackoff.isNegative() || maxBackoff.compareTo(initialBackoff) < 0) {
            throw new IllegalArgumentException(
                    "backoff must satisfy 0 <= initial <= max, got initial=" + initialBackoff + " max=" + maxBackoff);
        }
        if (backoffMultiplier < 1.0) {
            throw new IllegalArgumentException("backoffMultiplier must be >= 1.0, got " + backoffMultiplier);
        }
    }

    public static SyncSettings defaults() {
        return new SyncSettings(DEFAULT_RESOURCE_NAME, true, Duration.ofMillis(200), Duration.ofSeconds(30), 2.0);
    }

    public SyncSettings withResourceName(String name) {
        return new SyncSettings(name, failFastOnInitialOpen, initialBackoff, maxBackoff, backoffMultiplier);
    }

    public SyncSettings withFailFastOnInitialOpen(boolean failFast) {
        return new SyncSettings(resourceName, failFast, initialBackoff, maxBackoff, backoffMultiplier);
    }

    public SyncSettings withBackoff(Duration initial, Duration max, double multiplier) {
        return new SyncSettings(resourceName, failFastOnInitialOpen, initial, max, multiplier);
    }
}
