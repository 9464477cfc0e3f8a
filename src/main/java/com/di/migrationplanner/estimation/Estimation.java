package com.di.migrationplanner.estimation;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;

/**
 * Result of a single calculator run: how long the stage takes and why.
 */
@Value
@Builder
public class Estimation {

    private static final double NANOS_PER_MINUTE = 60_000_000_000.0;
    private static final double NANOS_PER_SECOND = 1_000_000_000.0;
    private static final long MAX_NANO_SECONDS = Long.MAX_VALUE / 1_000_000_000L;

    Duration duration;
    /** Human-readable explanation, e.g. "600 min across 10 engineers (2 work days)". */
    String reason;

    /**
     * Creates an estimation from fractional minutes. Sub-nanosecond remainders are truncated.
     *
     * @throws EstimationException OUT_OF_RANGE if the duration does not fit in a {@link Duration}
     */
    public static Estimation ofMinutes(double minutes, String reason) {
        return new Estimation(toDuration(minutes), reason);
    }

    private static Duration toDuration(double minutes) {
        double nanos = minutes * NANOS_PER_MINUTE;
        if (nanos < Long.MAX_VALUE) {
            return Duration.ofNanos((long) nanos);
        }
        // Beyond ~292 years of nanoseconds: whole seconds plus the leftover fraction.
        double seconds = minutes * 60;
        if (seconds >= Long.MAX_VALUE) {
            throw EstimationException.outOfRange(null, String.format(
                    "estimated duration of %.0f min exceeds the supported range", minutes));
        }
        long wholeSeconds = (long) seconds;
        long nanoAdjustment = Math.min((long) ((seconds - wholeSeconds) * NANOS_PER_SECOND), 999_999_999L);
        return Duration.ofSeconds(wholeSeconds, nanoAdjustment);
    }

    public double getDurationMinutes() {
        if (duration == null) {
            return 0.0;
        }
        if (duration.getSeconds() < MAX_NANO_SECONDS) {
            return duration.toNanos() / NANOS_PER_MINUTE;
        }
        return duration.getSeconds() / 60.0 + duration.getNano() / NANOS_PER_MINUTE;
    }
}
