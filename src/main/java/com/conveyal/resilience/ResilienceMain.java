package com.conveyal.resilience;

import com.conveyal.resilience.batch.BatchResult;
import com.conveyal.resilience.batch.BatchRunner;
import com.conveyal.resilience.batch.MetricsCsvWriter;
import com.conveyal.resilience.data.CsvMobilityDataSource;
import com.conveyal.resilience.data.DataSource;
import com.conveyal.resilience.models.AreaSeries;
import com.conveyal.resilience.render.ChartJsonRenderer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Main entry point: read every area's series, compute the recovery metrics and write them out as a table.
 * The only argument is the path of the properties file, which defaults to resilience.properties.
 */
public class ResilienceMain {

    private static final Logger LOG = LoggerFactory.getLogger(ResilienceMain.class);

    public static void main (String... args) {
        LOG.info("Starting resilience analysis at {}", LocalDateTime.now());
        try {
            ResilienceConfig config = args.length > 0 ? new ResilienceConfig(args[0]) : new ResilienceConfig();
            BatchResult result = run(config);
            if (!result.failures.isEmpty()) {
                LOG.warn("{} of {} areas could not be analyzed", result.failures.size(), result.nAreas());
            }
        } catch (ResilienceException e) {
            LOG.error("Analysis failed: {}", e.getMessage());
            System.exit(1);
        } catch (IOException e) {
            LOG.error("Could not read or write analysis files", e);
            System.exit(1);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.error("Analysis was interrupted");
            System.exit(1);
        }
    }

    public static BatchResult run (ResilienceConfig config) throws IOException, InterruptedException {
        DataSource dataSource = new CsvMobilityDataSource(config);
        List<AreaSeries> areas = dataSource.load();

        BatchResult result = new BatchRunner(config).run(areas);

        MetricsCsvWriter writer = new MetricsCsvWriter(dataSource.usesDates());
        writer.writeMetrics(result.records(), new File(config.outputFile()));
        if (config.failuresFile() != null) {
            writer.writeFailures(result.failures, new File(config.failuresFile()));
        }
        if (config.chartDirectory() != null) {
            new ChartJsonRenderer().renderAll(result.analyses.values(), new File(config.chartDirectory()));
        }
        LOG.info("Resilience analysis finished: {} areas, {} analyzed, {} failed",
                result.nAreas(), result.analyses.size(), result.failures.size());
        return result;
    }
}
