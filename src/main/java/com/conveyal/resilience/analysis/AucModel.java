package com.conveyal.resilience.analysis;

import com.conveyal.resilience.ResilienceException;
import com.conveyal.resilience.models.AnalysisConfig;
import com.conveyal.resilience.models.CleanedSeries;
import com.conveyal.resilience.models.DisruptionWindow;
import com.conveyal.resilience.models.MetricsRecord;
import com.conveyal.resilience.models.ModelType;
import com.conveyal.resilience.models.TimeRange;

/**
 * Area under the curve: cumulative loss is the integral of the absolute deviation from baseline over a window,
 * making no assumption about the shape of the curve. Absolute values are integrated so that overshooting the
 * baseline after a dip adds to the recorded disturbance instead of cancelling it.
 *
 * The window is either fixed in the configuration or runs from the located onset to the recovery, or to the end of
 * the series when there was none.
 */
public class AucModel implements ResilienceModel {

    private final DisruptionLocator locator = new DisruptionLocator();

    @Override
    public ModelType type () {
        return ModelType.AUC;
    }

    /** Locate the disruption and compute over the configured window. */
    public MetricsRecord compute (CleanedSeries cleaned, AnalysisConfig config) {
        return compute(cleaned, locator.locate(cleaned, config), config);
    }

    @Override
    public MetricsRecord compute (CleanedSeries cleaned, DisruptionWindow window, AnalysisConfig config) {
        if (!window.isDisrupted()) {
            if (config.requireDisruption) {
                throw ResilienceException.UnresolvedWindow("No disruption was detected in area " + cleaned.areaId);
            }
            return MetricsRecord.noDisruption(cleaned.areaId, ModelType.AUC);
        }
        int from;
        int to;
        if (config.fixedAucWindow != null) {
            TimeRange fixed = config.fixedAucWindow;
            from = 0;
            while (from < cleaned.size() && cleaned.time(from) < fixed.start) from++;
            to = cleaned.lastIndex();
            while (to >= 0 && cleaned.time(to) > fixed.end) to--;
            if (from > to) {
                throw ResilienceException.BadData(String.format("Fixed AUC window %s holds no samples of area %s.",
                        fixed, cleaned.areaId));
            }
        } else {
            from = window.onsetIndex;
            to = window.isRecovered() ? window.recoveryIndex : cleaned.lastIndex();
        }

        double magnitude = 0;
        for (int i = from; i <= to; i++) {
            magnitude = Math.max(magnitude, Math.abs(cleaned.deviation(i)));
        }
        double duration = cleaned.time(to) - cleaned.time(from);
        double rawArea = Trapezoid.absoluteDeviation(cleaned, from, to);
        double baselineArea = Trapezoid.baseline(cleaned, from, to);
        double extent = baselineArea > 0 ? rawArea / baselineArea : 0;

        return MetricsRecord.builder(cleaned.areaId, ModelType.AUC)
                .magnitude(magnitude)
                .duration(duration)
                .extent(extent)
                .rawArea(rawArea)
                .recovered(window.isRecovered())
                .onsetTime(cleaned.time(window.onsetIndex))
                .troughTime(cleaned.time(window.troughIndex))
                .recoveryTime(window.isRecovered() ? cleaned.time(window.recoveryIndex) : MetricsRecord.UNDEFINED)
                .build();
    }
}
