package com.conveyal.resilience.batch;

import com.conveyal.resilience.models.MetricsRecord;
import com.conveyal.resilience.util.TimeValues;
import com.csvreader.CsvWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.File;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static com.conveyal.resilience.util.TimeValues.formatNumber;

/**
 * Writes batch results as flat tables, one row per area and model. Undefined quantities become empty cells.
 */
public class MetricsCsvWriter {

    private static final Logger LOG = LoggerFactory.getLogger(MetricsCsvWriter.class);

    public static final String[] METRICS_HEADER = {
            "area_id", "model", "magnitude", "duration", "rapidity", "recovery_rate", "robustness",
            "extent", "raw_area", "recovered", "onset", "trough", "recovery"
    };

    public static final String[] FAILURES_HEADER = {"area_id", "error", "message"};

    /** Write located times as ISO dates rather than day numbers. */
    private final boolean datesAsIso;

    public MetricsCsvWriter (boolean datesAsIso) {
        this.datesAsIso = datesAsIso;
    }

    public void writeMetrics (List<MetricsRecord> records, File file) throws IOException {
        try (Writer out = open(file)) {
            writeMetrics(records, out);
        }
        LOG.info("Wrote {} metrics rows to {}", records.size(), file);
    }

    public void writeFailures (List<AreaFailure> failures, File file) throws IOException {
        try (Writer out = open(file)) {
            writeFailures(failures, out);
        }
        LOG.info("Wrote {} failed areas to {}", failures.size(), file);
    }

    public void writeMetrics (List<MetricsRecord> records, Writer out) throws IOException {
        CsvWriter writer = new CsvWriter(out, ',');
        writer.writeRecord(METRICS_HEADER);
        for (MetricsRecord record : records) {
            writer.writeRecord(new String[]{
                    record.areaId,
                    record.model.label(),
                    formatNumber(record.magnitude),
                    formatNumber(record.duration),
                    formatNumber(record.rapidity),
                    formatNumber(record.recoveryRate),
                    formatNumber(record.robustness),
                    formatNumber(record.extent),
                    formatNumber(record.rawArea),
                    Boolean.toString(record.recovered),
                    TimeValues.format(record.onsetTime, datesAsIso),
                    TimeValues.format(record.troughTime, datesAsIso),
                    TimeValues.format(record.recoveryTime, datesAsIso)
            });
        }
        writer.flush();
    }

    public void writeFailures (List<AreaFailure> failures, Writer out) throws IOException {
        CsvWriter writer = new CsvWriter(out, ',');
        writer.writeRecord(FAILURES_HEADER);
        for (AreaFailure failure : failures) {
            writer.writeRecord(new String[]{failure.areaId, failure.type.name(), failure.message});
        }
        writer.flush();
    }

    private static Writer open (File file) throws IOException {
        File parent = file.getAbsoluteFile().getParentFile();
        if (parent != null) parent.mkdirs();
        return new BufferedWriter(new OutputStreamWriter(new FileOutputStream(file), StandardCharsets.UTF_8));
    }
}
