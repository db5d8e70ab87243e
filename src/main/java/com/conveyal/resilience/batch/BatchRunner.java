package com.conveyal.resilience.batch;

import com.conveyal.resilience.ExecutorServices;
import com.conveyal.resilience.ResilienceException;
import com.conveyal.resilience.analysis.AreaAnalysis;
import com.conveyal.resilience.analysis.AreaAnalyzer;
import com.conveyal.resilience.models.AnalysisConfig;
import com.conveyal.resilience.models.AreaSeries;
import com.conveyal.resilience.models.ModelType;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

/**
 * Analyzes many areas independently and gathers the results. Areas share nothing, so they are simply mapped over a
 * thread pool. An area that fails is recorded with its reason and the batch carries on with the others; nothing is
 * retried since the computation is deterministic.
 */
public class BatchRunner {

    private static final Logger LOG = LoggerFactory.getLogger(BatchRunner.class);

    public interface Config {
        AnalysisConfig analysisConfig ();
        Set<ModelType> models ();
        int threads ();
    }

    private final Config config;

    private final AreaAnalyzer analyzer = new AreaAnalyzer();

    private volatile BatchStatus status;

    public BatchRunner (Config config) {
        this.config = config;
    }

    public BatchResult run (List<AreaSeries> areas) throws InterruptedException {
        Set<String> seen = new HashSet<>();
        for (AreaSeries area : areas) {
            if (!seen.add(area.areaId)) {
                throw ResilienceException.BadData("Area " + area.areaId + " appears more than once in the batch.");
            }
        }
        BatchStatus status = new BatchStatus(areas.size());
        this.status = status;
        LOG.info("Analyzing {} areas with models {} on {} threads", areas.size(), config.models(), config.threads());

        ExecutorService executor = ExecutorServices.newFixedPool(config.threads(), "area-analysis");
        try {
            List<Future<AreaAnalysis>> futures = new ArrayList<>(areas.size());
            for (AreaSeries area : areas) {
                futures.add(executor.submit(() -> analyze(area, status)));
            }
            ImmutableSortedMap.Builder<String, AreaAnalysis> analyses = ImmutableSortedMap.naturalOrder();
            ImmutableList.Builder<AreaFailure> failures = ImmutableList.builder();
            for (int i = 0; i < areas.size(); i++) {
                String areaId = areas.get(i).areaId;
                try {
                    analyses.put(areaId, futures.get(i).get());
                } catch (ExecutionException e) {
                    ResilienceException cause = e.getCause() instanceof ResilienceException
                            ? (ResilienceException) e.getCause()
                            : ResilienceException.Unknown(e);
                    failures.add(AreaFailure.of(areaId, cause));
                }
            }
            BatchResult result = new BatchResult(analyses.build(), failures.build());
            LOG.info("Finished {} areas: {} analyzed, {} failed",
                    result.nAreas(), result.analyses.size(), result.failures.size());
            return result;
        } finally {
            executor.shutdownNow();
        }
    }

    /** Progress of the current or most recent run, or null before the first one. */
    public BatchStatus getStatus () {
        return status;
    }

    private AreaAnalysis analyze (AreaSeries area, BatchStatus status) {
        try {
            AreaAnalysis analysis = analyzer.analyze(area, config.analysisConfig(), config.models());
            status.recordSuccess();
            return analysis;
        } catch (ResilienceException e) {
            LOG.warn("Area {} could not be analyzed: {}", area.areaId, e.getMessage());
            status.recordFailure();
            throw e;
        } catch (RuntimeException e) {
            LOG.warn("Unexpected error analyzing area {}", area.areaId, e);
            status.recordFailure();
            throw ResilienceException.Unknown(e);
        }
    }
}
