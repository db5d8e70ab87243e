package com.conveyal.resilience.analysis;

import com.conveyal.resilience.models.CleanedSeries;

/** Trapezoidal integration over the samples of a cleaned series, using each segment's own width. */
public abstract class Trapezoid {

    /** Integral of the absolute deviation between samples from and to inclusive. */
    public static double absoluteDeviation (CleanedSeries cleaned, int from, int to) {
        double area = 0;
        for (int i = from; i < to; i++) {
            double width = cleaned.time(i + 1) - cleaned.time(i);
            area += width * (Math.abs(cleaned.deviation(i)) + Math.abs(cleaned.deviation(i + 1))) / 2;
        }
        return area;
    }

    /** Integral of the baseline between samples from and to inclusive. */
    public static double baseline (CleanedSeries cleaned, int from, int to) {
        double area = 0;
        for (int i = from; i < to; i++) {
            double width = cleaned.time(i + 1) - cleaned.time(i);
            area += width * (cleaned.baseline.valueAt(i) + cleaned.baseline.valueAt(i + 1)) / 2;
        }
        return area;
    }
}
