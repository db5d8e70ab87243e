package com.conveyal.resilience;

import com.conveyal.resilience.models.AreaSeries;
import com.conveyal.resilience.models.MobilitySeries;

import java.util.Arrays;

/**
 * Hand-built series shared by the tests. All are sampled once per time unit starting at zero, with a flat baseline
 * of 100 over the first seven samples.
 */
public abstract class SeriesFixtures {

    public static final double BASELINE = 100;

    /** Index of the first sample after the seven baseline samples. */
    public static final int DROP_START = 7;

    /**
     * Drops linearly to 40 below baseline over three samples (indexes 7 to 9), stays there for two more (10, 11),
     * then climbs back to baseline over three samples (12 to 14).
     */
    public static double[] triangleValues () {
        return concat(flat(7),
                new double[]{100 - 40.0 / 3, 100 - 80.0 / 3, 60, 60, 60, 100 - 80.0 / 3, 100 - 40.0 / 3, 100});
    }

    /** Falls to 60 and only climbs back to 70, never getting near the baseline again. */
    public static double[] unrecoveredValues () {
        return concat(flat(7), new double[]{80, 60, 60, 60, 65, 70, 70});
    }

    /** Small wiggles that never go more than 3% below the baseline. */
    public static double[] quietValues () {
        return concat(flat(7), new double[]{99, 98, 97, 99, 101, 102, 100, 98});
    }

    public static double[] flat (int n) {
        double[] values = new double[n];
        Arrays.fill(values, BASELINE);
        return values;
    }

    public static double[] concat (double[] a, double[] b) {
        double[] result = Arrays.copyOf(a, a.length + b.length);
        System.arraycopy(b, 0, result, a.length, b.length);
        return result;
    }

    public static AreaSeries area (String areaId, double... values) {
        return new AreaSeries(areaId, MobilitySeries.ofValues(values));
    }
}
