package com.conveyal.resilience.models;

import java.util.Arrays;

/**
 * A gap-handled series paired with its baseline, ready for the recovery models. Each sample carries its deviation
 * from the baseline and a flag telling whether its value was filled in rather than observed.
 *
 * Instances are immutable: the arrays are copied on the way in and never handed out.
 */
public final class CleanedSeries {

    public final String areaId;

    public final Baseline baseline;

    private final double[] times;
    private final double[] values;
    private final double[] deviations;
    private final boolean[] filled;

    /** Index of the first sample after the baseline window, where the search for a disruption begins. */
    public final int analysisStart;

    public CleanedSeries (String areaId, Baseline baseline, double[] times, double[] values, boolean[] filled) {
        if (times.length != values.length || times.length != filled.length) {
            throw new IllegalArgumentException("Times, values and fill flags must have the same length.");
        }
        this.areaId = areaId;
        this.baseline = baseline;
        this.times = times.clone();
        this.values = values.clone();
        this.filled = filled.clone();
        this.deviations = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            deviations[i] = values[i] - baseline.valueAt(i);
        }
        int start = 0;
        while (start < times.length && times[start] <= baseline.window.end) start++;
        this.analysisStart = start;
    }

    public int size () {
        return times.length;
    }

    public double time (int i) {
        return times[i];
    }

    public double value (int i) {
        return values[i];
    }

    public double deviation (int i) {
        return deviations[i];
    }

    /** Deviation as a fraction of the baseline, the scale on which onset and recovery thresholds are expressed. */
    public double relativeDeviation (int i) {
        return deviations[i] / baseline.valueAt(i);
    }

    public boolean isFilled (int i) {
        return filled[i];
    }

    public double firstTime () {
        return times[0];
    }

    public double lastTime () {
        return times[times.length - 1];
    }

    public int lastIndex () {
        return times.length - 1;
    }

    @Override
    public boolean equals (Object o) {
        if (this == o) return true;
        if (!(o instanceof CleanedSeries)) return false;
        CleanedSeries other = (CleanedSeries) o;
        return areaId.equals(other.areaId) && baseline.equals(other.baseline)
                && Arrays.equals(times, other.times) && Arrays.equals(values, other.values)
                && Arrays.equals(deviations, other.deviations) && Arrays.equals(filled, other.filled);
    }

    @Override
    public int hashCode () {
        return areaId.hashCode() * 31 + Arrays.hashCode(values);
    }

    @Override
    public String toString () {
        return "CleanedSeries{" + areaId + ", " + times.length + " samples, " + baseline + '}';
    }
}
