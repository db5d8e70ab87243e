package com.conveyal.resilience.batch;

import com.conveyal.resilience.analysis.AreaAnalysis;
import com.conveyal.resilience.models.MetricsRecord;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedMap;

/**
 * Outcome of a batch: the analyses of the areas that succeeded, keyed and sorted by area ID, plus one failure entry
 * for every area that did not.
 */
public final class BatchResult {

    public final ImmutableSortedMap<String, AreaAnalysis> analyses;

    public final ImmutableList<AreaFailure> failures;

    public BatchResult (ImmutableSortedMap<String, AreaAnalysis> analyses, ImmutableList<AreaFailure> failures) {
        this.analyses = analyses;
        this.failures = failures;
    }

    /** All metrics records, ordered by area ID and then by model. */
    public ImmutableList<MetricsRecord> records () {
        ImmutableList.Builder<MetricsRecord> builder = ImmutableList.builder();
        for (AreaAnalysis analysis : analyses.values()) {
            builder.addAll(analysis.recordList());
        }
        return builder.build();
    }

    public int nAreas () {
        return analyses.size() + failures.size();
    }
}
