package com.di.migrationplanner.estimation;

/**
 * Converts elapsed minutes into whole work days, always rounding up.
 */
public final class WorkDays {

    public static final double DEFAULT_WORK_HOURS_PER_DAY = 8.0;

    private WorkDays() {}

    /**
     * ceil(minutes / (hoursPerDay * 60)). Zero minutes is zero days; anything in
     * (0, hoursPerDay * 60] is exactly one day.
     *
     * @throws IllegalArgumentException if hoursPerDay is not positive or minutes is negative
     */
    public static long fromMinutes(double minutes, double hoursPerDay) {
        if (!(hoursPerDay > 0)) {
            throw new IllegalArgumentException("work hours per day must be positive, got " + hoursPerDay);
        }
        if (minutes < 0) {
            throw new IllegalArgumentException("minutes must be non-negative, got " + minutes);
        }
        return (long) Math.ceil(minutes / (hoursPerDay * 60.0));
    }
}
