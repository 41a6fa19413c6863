package com.libragraph.sdc.util;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;

/**
 * UTC timestamps with one-second resolution, as stored in container attributes.
 */
public final class Timestamps {

    private Timestamps() {
    }

    public static Instant now() {
        return now(Clock.systemUTC());
    }

    public static Instant now(Clock clock) {
        return truncate(clock.instant());
    }

    /** Drops sub-second precision; {@code null} stays {@code null}. */
    public static Instant truncate(Instant instant) {
        return instant == null ? null : instant.truncatedTo(ChronoUnit.SECONDS);
    }

    /**
     * Returns the later of the current time and {@code previous}, so a
     * timestamp never moves backwards.
     */
    public static Instant advance(Instant previous) {
        Instant now = now();
        if (previous == null || now.isAfter(previous)) {
            return now;
        }
        return previous;
    }
}
