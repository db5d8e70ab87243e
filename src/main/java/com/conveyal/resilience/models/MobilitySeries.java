package com.conveyal.resilience.models;

import com.conveyal.resilience.ResilienceException;
import com.google.common.collect.ImmutableList;

import java.util.List;

/**
 * The raw time series of a mobility indicator for one geographic area, in strictly increasing time order.
 * Missing samples are kept as explicit points (see {@link TimePoint#missing(double)}).
 */
public final class MobilitySeries {

    private final ImmutableList<TimePoint> points;

    public MobilitySeries (List<TimePoint> points) {
        this.points = ImmutableList.copyOf(points);
        for (int i = 0; i < this.points.size(); i++) {
            double time = this.points.get(i).time;
            if (Double.isNaN(time) || Double.isInfinite(time)) {
                throw ResilienceException.BadData("Sample " + i + " does not have a finite time.");
            }
            if (i > 0 && time <= this.points.get(i - 1).time) {
                throw ResilienceException.BadData(String.format(
                        "Times must be strictly increasing, but sample %d at %s follows %s.",
                        i, time, this.points.get(i - 1).time));
            }
        }
    }

    /** Convenience factory for evenly spaced samples starting at time zero with a step of one. */
    public static MobilitySeries ofValues (double... values) {
        ImmutableList.Builder<TimePoint> builder = ImmutableList.builder();
        for (int i = 0; i < values.length; i++) {
            builder.add(new TimePoint(i, values[i]));
        }
        return new MobilitySeries(builder.build());
    }

    public int size () {
        return points.size();
    }

    public TimePoint get (int i) {
        return points.get(i);
    }

    public double time (int i) {
        return points.get(i).time;
    }

    public double value (int i) {
        return points.get(i).value;
    }

    public boolean isMissing (int i) {
        return points.get(i).isMissing();
    }

    public int missingCount () {
        return (int) points.stream().filter(TimePoint::isMissing).count();
    }

    public ImmutableList<TimePoint> points () {
        return points;
    }

    @Override
    public boolean equals (Object o) {
        return o instanceof MobilitySeries && points.equals(((MobilitySeries) o).points);
    }

    @Override
    public int hashCode () {
        return points.hashCode();
    }
}
