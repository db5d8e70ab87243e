package com.conveyal.resilience.models;

import com.conveyal.resilience.ResilienceException;

import java.util.Objects;

/** A closed interval of time, both ends included. */
public final class TimeRange {

    public final double start;

    public final double end;

    public TimeRange (double start, double end) {
        if (Double.isNaN(start) || Double.isNaN(end) || end < start) {
            throw ResilienceException.BadConfig(String.format("Invalid time range [%s, %s].", start, end));
        }
        this.start = start;
        this.end = end;
    }

    public boolean contains (double time) {
        return time >= start && time <= end;
    }

    public double duration () {
        return end - start;
    }

    @Override
    public boolean equals (Object o) {
        if (!(o instanceof TimeRange)) return false;
        TimeRange other = (TimeRange) o;
        return Double.compare(start, other.start) == 0 && Double.compare(end, other.end) == 0;
    }

    @Override
    public int hashCode () {
        return Objects.hash(start, end);
    }

    @Override
    public String toString () {
        return "[" + start + ", " + end + "]";
    }
}
