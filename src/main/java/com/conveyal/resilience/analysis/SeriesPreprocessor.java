package com.conveyal.resilience.analysis;

import com.conveyal.resilience.ResilienceException;
import com.conveyal.resilience.models.AnalysisConfig;
import com.conveyal.resilience.models.AreaSeries;
import com.conveyal.resilience.models.Baseline;
import com.conveyal.resilience.models.BaselineMethod;
import com.conveyal.resilience.models.CleanedSeries;
import com.conveyal.resilience.models.GapPolicy;
import com.conveyal.resilience.models.MobilitySeries;
import com.conveyal.resilience.models.TimeRange;
import com.google.common.primitives.Doubles;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Turns a raw series into a {@link CleanedSeries}: applies the gap policy, optionally smooths, derives the baseline
 * from the reference window and computes every sample's deviation from it.
 *
 * This is a pure function of its inputs. The same series and configuration always give an equal result.
 */
public class SeriesPreprocessor {

    public CleanedSeries prepare (AreaSeries area, AnalysisConfig config) {
        TimeRange window = area.baselineWindow != null ? area.baselineWindow : config.baselineWindow;
        return prepare(area.areaId, area.series, window, config);
    }

    /**
     * @param baselineWindow the reference period, or null to use the first minBaselinePoints samples with data.
     */
    public CleanedSeries prepare (String areaId, MobilitySeries series, TimeRange baselineWindow, AnalysisConfig config) {
        if (series.size() == 0) {
            throw ResilienceException.InsufficientBaselineData("Series for area " + areaId + " is empty.");
        }
        if (config.gapPolicy == GapPolicy.FAIL && series.missingCount() > 0) {
            int firstMissing = 0;
            while (!series.isMissing(firstMissing)) firstMissing++;
            throw ResilienceException.IncompleteSeries(String.format(
                    "Area %s has %d samples without data, the first at time %s.",
                    areaId, series.missingCount(), series.time(firstMissing)));
        }
        if (baselineWindow == null) {
            // Extend to the minBaselinePoints-th sample with data, so early gaps do not starve the baseline.
            int last = 0;
            int nObserved = 0;
            for (int i = 0; i < series.size() && nObserved < config.minBaselinePoints; i++) {
                if (!series.isMissing(i)) nObserved++;
                last = i;
            }
            baselineWindow = new TimeRange(series.time(0), series.time(last));
        }

        int nObservedInWindow = 0;
        for (int i = 0; i < series.size(); i++) {
            if (baselineWindow.contains(series.time(i)) && !series.isMissing(i)) nObservedInWindow++;
        }
        if (nObservedInWindow < config.minBaselinePoints) {
            throw ResilienceException.InsufficientBaselineData(String.format(
                    "Baseline window %s of area %s holds %d samples with data, at least %d are required.",
                    baselineWindow, areaId, nObservedInWindow, config.minBaselinePoints));
        }

        // Indexes into the raw series of the samples retained downstream.
        List<Integer> kept = new ArrayList<>(series.size());
        for (int i = 0; i < series.size(); i++) {
            if (config.gapPolicy != GapPolicy.DROP || !series.isMissing(i)) kept.add(i);
        }
        int n = kept.size();
        double[] times = new double[n];
        double[] values = new double[n];
        boolean[] filled = new boolean[n];
        for (int k = 0; k < n; k++) {
            int i = kept.get(k);
            times[k] = series.time(i);
            if (series.isMissing(i)) {
                values[k] = interpolate(series, i);
                filled[k] = true;
            } else {
                values[k] = series.value(i);
            }
        }
        if (config.smoothingPeriod > 1) {
            values = smooth(values, config.smoothingPeriod);
        }

        List<Double> reference = new ArrayList<>(nObservedInWindow);
        for (int k = 0; k < n; k++) {
            if (!filled[k] && baselineWindow.contains(times[k])) reference.add(values[k]);
        }
        double level = summarize(Doubles.toArray(reference), config.baselineMethod);
        if (!(level > 0)) {
            throw ResilienceException.InsufficientBaselineData(String.format(
                    "Baseline level of area %s is %s, deviations cannot be measured relative to it.", areaId, level));
        }
        Baseline baseline = new Baseline(config.baselineMethod, level, reference.size(), baselineWindow);
        return new CleanedSeries(areaId, baseline, times, values, filled);
    }

    /**
     * Linear interpolation in time between the nearest observed samples on either side. Where one side has no
     * observed sample the nearest observed value is carried over.
     */
    static double interpolate (MobilitySeries series, int i) {
        int before = i - 1;
        while (before >= 0 && series.isMissing(before)) before--;
        int after = i + 1;
        while (after < series.size() && series.isMissing(after)) after++;
        boolean hasBefore = before >= 0;
        boolean hasAfter = after < series.size();
        if (hasBefore && hasAfter) {
            double t0 = series.time(before);
            double t1 = series.time(after);
            double v0 = series.value(before);
            double v1 = series.value(after);
            return v0 + (v1 - v0) * (series.time(i) - t0) / (t1 - t0);
        } else if (hasBefore) {
            return series.value(before);
        } else if (hasAfter) {
            return series.value(after);
        }
        throw ResilienceException.InsufficientBaselineData("Series has no samples with data.");
    }

    /**
     * Centered rolling mean, shrinking the window at both ends of the series rather than producing gaps.
     * For an even period the extra sample is taken on the left.
     */
    static double[] smooth (double[] values, int period) {
        double[] smoothed = new double[values.length];
        int left = period / 2;
        int right = (period - 1) / 2;
        for (int i = 0; i < values.length; i++) {
            int from = Math.max(0, i - left);
            int to = Math.min(values.length - 1, i + right);
            double sum = 0;
            for (int j = from; j <= to; j++) sum += values[j];
            smoothed[i] = sum / (to - from + 1);
        }
        return smoothed;
    }

    static double summarize (double[] reference, BaselineMethod method) {
        switch (method) {
            case MEAN:
                return Arrays.stream(reference).average().orElse(Double.NaN);
            case MEDIAN:
                double[] sorted = reference.clone();
                Arrays.sort(sorted);
                int mid = sorted.length / 2;
                return sorted.length % 2 == 1 ? sorted[mid] : (sorted[mid - 1] + sorted[mid]) / 2;
            default:
                throw ResilienceException.BadConfig("Unsupported baseline method " + method);
        }
    }
}
