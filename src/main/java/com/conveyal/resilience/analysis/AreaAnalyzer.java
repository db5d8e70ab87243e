package com.conveyal.resilience.analysis;

import com.conveyal.resilience.ResilienceException;
import com.conveyal.resilience.models.AnalysisConfig;
import com.conveyal.resilience.models.AreaSeries;
import com.conveyal.resilience.models.CleanedSeries;
import com.conveyal.resilience.models.DisruptionWindow;
import com.conveyal.resilience.models.MetricsRecord;
import com.conveyal.resilience.models.ModelType;
import com.google.common.collect.ImmutableMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.EnumSet;

/**
 * Runs the whole computation for a single area: preprocess once, locate the disruption once, then feed the same
 * cleaned series and window to each requested model. Holds no per-area state and is safe to share across threads.
 */
public class AreaAnalyzer {

    private static final Logger LOG = LoggerFactory.getLogger(AreaAnalyzer.class);

    private final SeriesPreprocessor preprocessor = new SeriesPreprocessor();

    private final DisruptionLocator locator = new DisruptionLocator();

    public AreaAnalysis analyze (AreaSeries area, AnalysisConfig config, Collection<ModelType> models) {
        if (models.isEmpty()) {
            throw ResilienceException.BadConfig("At least one model must be requested.");
        }
        CleanedSeries cleaned = preprocessor.prepare(area, config);
        DisruptionWindow window = locator.locate(cleaned, config);
        ImmutableMap.Builder<ModelType, MetricsRecord> records = ImmutableMap.builder();
        // Enum order, so the output does not depend on the order models were requested in.
        for (ModelType type : EnumSet.copyOf(models)) {
            MetricsRecord record = ResilienceModel.forType(type).compute(cleaned, window, config);
            LOG.debug("{}", record);
            records.put(type, record);
        }
        return new AreaAnalysis(cleaned, window, records.build());
    }

    /** Convenience for the single-model case: a pure function from series and configuration to a record. */
    public MetricsRecord compute (AreaSeries area, AnalysisConfig config, ModelType model) {
        return analyze(area, config, EnumSet.of(model)).record(model);
    }
}
