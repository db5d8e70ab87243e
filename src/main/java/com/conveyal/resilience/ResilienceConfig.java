package com.conveyal.resilience;

import com.conveyal.resilience.batch.BatchRunner;
import com.conveyal.resilience.data.CsvMobilityDataSource;
import com.conveyal.resilience.models.AnalysisConfig;
import com.conveyal.resilience.models.BaselineMethod;
import com.conveyal.resilience.models.GapPolicy;
import com.conveyal.resilience.models.ModelType;
import com.conveyal.resilience.models.TimeRange;
import com.conveyal.resilience.util.TimeValues;
import com.google.common.base.Splitter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.Properties;
import java.util.Set;

/**
 * Represents config information for a resilience analysis run, read from a properties file. Only the input and
 * output locations are required; every analysis setting has a default, see {@link AnalysisConfig}.
 */
public class ResilienceConfig implements CsvMobilityDataSource.Config, BatchRunner.Config {

    private static final Logger LOG = LoggerFactory.getLogger(ResilienceConfig.class);

    public static final String PROPERTIES_FILE_NAME = "resilience.properties";

    public static final int DEFAULT_BASELINE_DAYS = 15;

    protected Properties config;
    protected Set<String> missingKeys = new LinkedHashSet<>();

    private final String inputFile;
    private final String outputFile;
    private final String failuresFile;
    private final String chartDirectory;
    private final String areaColumn;
    private final String timeColumn;
    private final String valueColumn;
    private final int threads;
    private final Set<ModelType> models;
    private final AnalysisConfig analysisConfig;

    public ResilienceConfig () {
        this(PROPERTIES_FILE_NAME);
    }

    public ResilienceConfig (String filename) {
        this(load(filename));
    }

    public ResilienceConfig (Properties properties) {
        config = properties;
        inputFile = getProperty("input-file", true);
        outputFile = getProperty("output-file", true);
        failuresFile = getProperty("failures-file", false);
        chartDirectory = getProperty("chart-directory", false);
        areaColumn = getProperty("area-column", "area_id");
        timeColumn = getProperty("time-column", "date");
        valueColumn = getProperty("value-column", "value");
        if (!missingKeys.isEmpty()) {
            LOG.error("You must provide these configuration properties: {}", String.join(", ", missingKeys));
            throw ResilienceException.BadConfig("Missing configuration properties: " + String.join(", ", missingKeys));
        }
        try {
            threads = Integer.parseInt(getProperty("threads", Integer.toString(ExecutorServices.defaultThreads())));
            models = parseModels(getProperty("models", "triangle,auc"));
            analysisConfig = AnalysisConfig.builder()
                    .baselineWindow(parseBaselineWindow())
                    .gapPolicy(GapPolicy.valueOf(getProperty("gap-policy", "interpolate").trim().toUpperCase()))
                    .baselineMethod(BaselineMethod.valueOf(getProperty("baseline-method", "mean").trim().toUpperCase()))
                    .minBaselinePoints(Integer.parseInt(getProperty("min-baseline-points", "7")))
                    .onsetThreshold(Double.parseDouble(getProperty("onset-threshold", "-0.05")))
                    .minDwellForRecovery(Integer.parseInt(getProperty("min-dwell-for-recovery", "1")))
                    .maxLookahead(Integer.parseInt(getProperty("max-lookahead", "0")))
                    .fixedAucWindow(parseRange("fixed-auc-window-start", "fixed-auc-window-end"))
                    .smoothingPeriod(Integer.parseInt(getProperty("smoothing-period", "1")))
                    .requireDisruption(Boolean.parseBoolean(getProperty("require-disruption", "false")))
                    .build();
        } catch (IllegalArgumentException e) {
            // Covers NumberFormatException and unknown enum names.
            LOG.error("Invalid configuration: {}", e.getMessage());
            throw ResilienceException.BadConfig("Invalid configuration: " + e.getMessage());
        }
        if (threads < 1) {
            throw ResilienceException.BadConfig("threads must be at least 1.");
        }
        LOG.info("Loaded configuration: {}", analysisConfig);
    }

    private static Properties load (String filename) {
        Properties properties = new Properties();
        try (InputStream is = new FileInputStream(filename)) {
            properties.load(is);
        } catch (IOException e) {
            String message = "Could not read config file " + filename;
            LOG.error(message);
            throw new ResilienceException(ResilienceException.TYPE.BAD_CONFIG, message, e);
        }
        return properties;
    }

    private String getProperty (String key, boolean require) {
        String value = config.getProperty(key);
        if (value != null && value.isBlank()) value = null;
        if (require && value == null) {
            LOG.error("Missing configuration option {}", key);
            missingKeys.add(key);
        }
        return value;
    }

    private String getProperty (String key, String defaultValue) {
        String value = getProperty(key, false);
        return value == null ? defaultValue : value;
    }

    /**
     * An explicit baseline-start / baseline-end pair wins. Otherwise, given the start of the event, the baseline is
     * the baseline-days time units that end just before it. With neither, each series uses its first samples.
     */
    private TimeRange parseBaselineWindow () {
        TimeRange explicit = parseRange("baseline-start", "baseline-end");
        if (explicit != null) return explicit;
        String eventStart = getProperty("event-start", false);
        if (eventStart == null) return null;
        double start = TimeValues.parse(eventStart);
        int days = Integer.parseInt(getProperty("baseline-days", Integer.toString(DEFAULT_BASELINE_DAYS)));
        return new TimeRange(start - days, start - 1);
    }

    private TimeRange parseRange (String startKey, String endKey) {
        String start = getProperty(startKey, false);
        String end = getProperty(endKey, false);
        if (start == null && end == null) return null;
        if (start == null || end == null) {
            throw ResilienceException.BadConfig(startKey + " and " + endKey + " must be given together.");
        }
        return new TimeRange(TimeValues.parse(start), TimeValues.parse(end));
    }

    private static Set<ModelType> parseModels (String list) {
        EnumSet<ModelType> models = EnumSet.noneOf(ModelType.class);
        for (String label : Splitter.on(',').trimResults().omitEmptyStrings().split(list)) {
            models.add(ModelType.fromLabel(label));
        }
        if (models.isEmpty()) {
            throw ResilienceException.BadConfig("At least one model must be configured.");
        }
        return Collections.unmodifiableSet(models);
    }

    public String outputFile () { return outputFile; }
    public String failuresFile () { return failuresFile; }
    public String chartDirectory () { return chartDirectory; }

    // Implementations of component Config interfaces

    @Override public String inputFile () { return inputFile; }
    @Override public String areaColumn () { return areaColumn; }
    @Override public String timeColumn () { return timeColumn; }
    @Override public String valueColumn () { return valueColumn; }
    @Override public AnalysisConfig analysisConfig () { return analysisConfig; }
    @Override public Set<ModelType> models () { return models; }
    @Override public int threads () { return threads; }

}
