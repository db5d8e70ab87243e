package com.conveyal.resilience.analysis;

import com.conveyal.resilience.ResilienceException;
import com.conveyal.resilience.models.AnalysisConfig;
import com.conveyal.resilience.models.CleanedSeries;
import com.conveyal.resilience.models.DisruptionWindow;
import com.conveyal.resilience.models.MetricsRecord;
import com.conveyal.resilience.models.ModelType;

/**
 * Resilience triangle: the deviation curve is reduced to the triangle spanned by onset, trough and recovery (or the
 * last sample when the area has not recovered). Depth, base and the slopes of its two sides give the metrics.
 */
public class TriangleModel implements ResilienceModel {

    @Override
    public ModelType type () {
        return ModelType.TRIANGLE;
    }

    @Override
    public MetricsRecord compute (CleanedSeries cleaned, DisruptionWindow window, AnalysisConfig config) {
        return compute(cleaned, window, config.requireDisruption);
    }

    public MetricsRecord compute (CleanedSeries cleaned, DisruptionWindow window) {
        return compute(cleaned, window, false);
    }

    public MetricsRecord compute (CleanedSeries cleaned, DisruptionWindow window, boolean requireDisruption) {
        if (!window.isDisrupted()) {
            if (requireDisruption) {
                throw ResilienceException.UnresolvedWindow("No disruption was detected in area " + cleaned.areaId);
            }
            return MetricsRecord.noDisruption(cleaned.areaId, ModelType.TRIANGLE);
        }
        int onset = window.onsetIndex;
        int trough = window.troughIndex;
        boolean recovered = window.isRecovered();
        int end = recovered ? window.recoveryIndex : cleaned.lastIndex();

        double magnitude = Math.abs(cleaned.deviation(trough));
        double duration = cleaned.time(end) - cleaned.time(onset);

        // When the onset is already the deepest sample the fall happened within the preceding sampling step.
        double declineTime = cleaned.time(trough) - cleaned.time(onset);
        if (declineTime == 0) {
            declineTime = onset > 0 ? cleaned.time(onset) - cleaned.time(onset - 1) : Double.NaN;
        }
        double rapidity = magnitude / declineTime;
        double recoveryRate = recovered
                ? magnitude / (cleaned.time(end) - cleaned.time(trough))
                : MetricsRecord.UNDEFINED;

        // Deviations deeper than the baseline itself (negative activity) would give negative robustness.
        double robustness = clamp(1 - magnitude / cleaned.baseline.valueAt(trough), 0, 1);

        // Still at its lowest on the last sample: close the triangle at the baseline rather than collapse it.
        double endDeviation = end == trough ? 0 : cleaned.deviation(end);
        double area = triangleArea(
                cleaned.time(onset), cleaned.deviation(onset),
                cleaned.time(trough), cleaned.deviation(trough),
                cleaned.time(end), endDeviation);
        double baselineArea = Trapezoid.baseline(cleaned, onset, end);
        double extent = baselineArea > 0 ? area / baselineArea : 0;

        return MetricsRecord.builder(cleaned.areaId, ModelType.TRIANGLE)
                .magnitude(magnitude)
                .duration(duration)
                .rapidity(rapidity)
                .recoveryRate(recoveryRate)
                .robustness(robustness)
                .extent(extent)
                .rawArea(area)
                .recovered(recovered)
                .onsetTime(cleaned.time(onset))
                .troughTime(cleaned.time(trough))
                .recoveryTime(recovered ? cleaned.time(end) : MetricsRecord.UNDEFINED)
                .build();
    }

    /** Shoelace formula. Times are taken relative to the first vertex to keep the products small. */
    static double triangleArea (double t1, double y1, double t2, double y2, double t3, double y3) {
        double x2 = t2 - t1;
        double x3 = t3 - t1;
        return 0.5 * Math.abs(x2 * (y3 - y1) + x3 * (y1 - y2));
    }

    static double clamp (double value, double min, double max) {
        return Math.max(min, Math.min(max, value));
    }
}
