package com.conveyal.resilience.analysis;

import com.conveyal.resilience.models.CleanedSeries;
import com.conveyal.resilience.models.DisruptionWindow;
import com.conveyal.resilience.models.MetricsRecord;
import com.conveyal.resilience.models.ModelType;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

/**
 * Everything computed for one area: the cleaned curve and located window a renderer needs to draw it, and one
 * metrics record per requested model.
 */
public final class AreaAnalysis {

    public final String areaId;

    public final CleanedSeries cleaned;

    public final DisruptionWindow window;

    public final ImmutableMap<ModelType, MetricsRecord> records;

    public AreaAnalysis (CleanedSeries cleaned, DisruptionWindow window, ImmutableMap<ModelType, MetricsRecord> records) {
        this.areaId = cleaned.areaId;
        this.cleaned = cleaned;
        this.window = window;
        this.records = records;
    }

    public MetricsRecord record (ModelType model) {
        return records.get(model);
    }

    public ImmutableList<MetricsRecord> recordList () {
        return records.values().asList();
    }
}
