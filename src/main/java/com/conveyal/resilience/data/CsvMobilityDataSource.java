package com.conveyal.resilience.data;

import com.conveyal.resilience.ResilienceException;
import com.conveyal.resilience.models.AreaSeries;
import com.conveyal.resilience.models.MobilitySeries;
import com.conveyal.resilience.models.TimePoint;
import com.conveyal.resilience.util.TimeValues;
import com.csvreader.CsvReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Reads long-format mobility data, one row per area, time and value, e.g. device counts arriving at a destination
 * block group on a given day. Several rows for the same area and time are summed, so trip-level rows turn into the
 * in-flow of each destination.
 *
 * Empty, NA and NaN value cells are kept as samples without data. When times are calendar dates, days missing from
 * the file between an area's first and last date are added as samples without data too.
 */
public class CsvMobilityDataSource implements DataSource {

    private static final Logger LOG = LoggerFactory.getLogger(CsvMobilityDataSource.class);

    public interface Config {
        String inputFile ();
        String areaColumn ();
        String timeColumn ();
        String valueColumn ();
    }

    private final Config config;

    private Boolean usesDates;

    public CsvMobilityDataSource (Config config) {
        this.config = config;
    }

    @Override
    public List<AreaSeries> load () throws IOException {
        LOG.info("Reading mobility data from {}", config.inputFile());
        try (Reader reader = new InputStreamReader(new FileInputStream(config.inputFile()), StandardCharsets.UTF_8)) {
            return load(reader);
        }
    }

    public List<AreaSeries> load (Reader input) throws IOException {
        // Decided afresh by the first row of each load.
        usesDates = null;
        // Area ID -> time -> summed value, both sorted.
        Map<String, TreeMap<Double, Double>> valuesByArea = new TreeMap<>();
        CsvReader reader = new CsvReader(input, ',');
        try {
            if (!reader.readHeaders()) {
                throw ResilienceException.BadData("Mobility data file is empty.");
            }
            for (String column : new String[]{config.areaColumn(), config.timeColumn(), config.valueColumn()}) {
                if (reader.getIndex(column) < 0) {
                    throw ResilienceException.BadData("Mobility data has no column named " + column);
                }
            }
            int nRows = 0;
            while (reader.readRecord()) {
                nRows++;
                String areaId = reader.get(config.areaColumn()).trim();
                String timeText = reader.get(config.timeColumn());
                if (areaId.isEmpty() || timeText.isBlank()) {
                    throw ResilienceException.BadData("Row " + nRows + " has no area or no time.");
                }
                double time = parseTime(timeText, nRows);
                double value = parseValue(reader.get(config.valueColumn()), nRows);
                valuesByArea.computeIfAbsent(areaId, k -> new TreeMap<>()).merge(time, value, CsvMobilityDataSource::sum);
            }
            LOG.info("Read {} rows for {} areas", nRows, valuesByArea.size());
        } finally {
            reader.close();
        }

        List<AreaSeries> areas = new ArrayList<>(valuesByArea.size());
        for (Map.Entry<String, TreeMap<Double, Double>> entry : valuesByArea.entrySet()) {
            areas.add(new AreaSeries(entry.getKey(), toSeries(entry.getValue())));
        }
        return areas;
    }

    @Override
    public boolean usesDates () {
        return usesDates != null && usesDates;
    }

    private MobilitySeries toSeries (TreeMap<Double, Double> values) {
        List<TimePoint> points = new ArrayList<>(values.size());
        if (usesDates()) {
            long first = values.firstKey().longValue();
            long last = values.lastKey().longValue();
            for (long day = first; day <= last; day++) {
                Double value = values.get((double) day);
                points.add(value == null ? TimePoint.missing(day) : new TimePoint(day, value));
            }
        } else {
            values.forEach((time, value) -> points.add(new TimePoint(time, value)));
        }
        return new MobilitySeries(points);
    }

    private double parseTime (String text, int row) {
        boolean date = TimeValues.isDate(text);
        if (usesDates == null) {
            usesDates = date;
        } else if (usesDates != date) {
            throw ResilienceException.BadData("Row " + row + " mixes calendar dates and numeric times.");
        }
        try {
            return TimeValues.parse(text);
        } catch (NumberFormatException e) {
            throw ResilienceException.BadData("Row " + row + " has an unreadable time: " + text);
        }
    }

    private static double parseValue (String text, int row) {
        String trimmed = text.trim();
        if (trimmed.isEmpty() || trimmed.equalsIgnoreCase("NA") || trimmed.equalsIgnoreCase("NaN")) {
            return TimePoint.MISSING;
        }
        try {
            return Double.parseDouble(trimmed);
        } catch (NumberFormatException e) {
            throw ResilienceException.BadData("Row " + row + " has an unreadable value: " + text);
        }
    }

    /** Rows without data do not contribute, but a time where every row lacks data stays missing. */
    private static double sum (double a, double b) {
        if (Double.isNaN(a)) return b;
        if (Double.isNaN(b)) return a;
        return a + b;
    }
}
