package com.conveyal.resilience.analysis;

import com.conveyal.resilience.models.AnalysisConfig;
import com.conveyal.resilience.models.CleanedSeries;
import com.conveyal.resilience.models.DisruptionWindow;
import com.conveyal.resilience.models.MetricsRecord;
import com.conveyal.resilience.models.ModelType;

/**
 * A recovery model reduces one cleaned series to a {@link MetricsRecord}. Implementations hold no state, so a single
 * instance can serve any number of areas concurrently.
 */
public interface ResilienceModel {

    ModelType type ();

    MetricsRecord compute (CleanedSeries cleaned, DisruptionWindow window, AnalysisConfig config);

    static ResilienceModel forType (ModelType type) {
        switch (type) {
            case TRIANGLE: return new TriangleModel();
            case AUC: return new AucModel();
            default: throw new IllegalArgumentException("Unknown model " + type);
        }
    }
}
