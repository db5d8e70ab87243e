package com.conveyal.resilience.models;

import java.util.Objects;

/**
 * One sample of a mobility indicator. A sample with no data keeps its time and carries NaN as its value, so that
 * gaps stay visible all the way to the preprocessor.
 */
public final class TimePoint {

    public static final double MISSING = Double.NaN;

    /** Time in the series' own units, e.g. days since the epoch for daily data. */
    public final double time;

    public final double value;

    public TimePoint (double time, double value) {
        this.time = time;
        this.value = value;
    }

    public static TimePoint missing (double time) {
        return new TimePoint(time, MISSING);
    }

    public boolean isMissing () {
        return Double.isNaN(value);
    }

    @Override
    public boolean equals (Object o) {
        if (this == o) return true;
        if (!(o instanceof TimePoint)) return false;
        TimePoint other = (TimePoint) o;
        return Double.compare(time, other.time) == 0 && Double.compare(value, other.value) == 0;
    }

    @Override
    public int hashCode () {
        return Objects.hash(time, value);
    }

    @Override
    public String toString () {
        return isMissing() ? String.format("(%s, no data)", time) : String.format("(%s, %s)", time, value);
    }
}
