package com.conveyal.resilience.models;

/**
 * Expected level of the indicator absent any disruption, derived from the reference period of a single series.
 * Currently a single level for every sample; callers ask for it by index so a per-sample baseline can be
 * substituted without changing them.
 */
public final class Baseline {

    public final BaselineMethod method;

    public final double level;

    /** Number of observed samples that went into the level. */
    public final int nPoints;

    public final TimeRange window;

    public Baseline (BaselineMethod method, double level, int nPoints, TimeRange window) {
        this.method = method;
        this.level = level;
        this.nPoints = nPoints;
        this.window = window;
    }

    public double valueAt (int index) {
        return level;
    }

    @Override
    public boolean equals (Object o) {
        if (!(o instanceof Baseline)) return false;
        Baseline other = (Baseline) o;
        return method == other.method && Double.compare(level, other.level) == 0 && nPoints == other.nPoints
                && window.equals(other.window);
    }

    @Override
    public int hashCode () {
        return Double.hashCode(level) * 31 + nPoints;
    }

    @Override
    public String toString () {
        return "Baseline{" + method + " " + level + " over " + nPoints + " samples in " + window + '}';
    }
}
