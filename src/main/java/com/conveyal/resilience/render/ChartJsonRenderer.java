package com.conveyal.resilience.render;

import com.conveyal.resilience.analysis.AreaAnalysis;
import com.conveyal.resilience.models.CleanedSeries;
import com.conveyal.resilience.models.DisruptionWindow;
import com.conveyal.resilience.models.MetricsRecord;
import com.conveyal.resilience.models.ModelType;
import com.conveyal.resilience.util.JsonUtil;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.util.Collection;
import java.util.HashSet;
import java.util.Locale;
import java.util.Set;

/**
 * Writes the data behind a recovery chart as JSON: the cleaned curve, the baseline, the critical events, the
 * triangle's corners and the region integrated by the AUC model, plus the metrics for annotation. Drawing is left
 * to whatever plotting tool reads the file.
 */
public class ChartJsonRenderer implements Renderer {

    private static final Logger LOG = LoggerFactory.getLogger(ChartJsonRenderer.class);

    private final ObjectMapper mapper = JsonUtil.objectMapper;

    @Override
    public void render (AreaAnalysis analysis, OutputStream out) throws IOException {
        // Leave the stream open for the caller to close.
        mapper.writer().without(JsonGenerator.Feature.AUTO_CLOSE_TARGET).writeValue(out, toJson(analysis));
    }

    @Override
    public String extension () {
        return "json";
    }

    /** One file per area in the given directory, named after the area. */
    public void renderAll (Collection<AreaAnalysis> analyses, File directory) throws IOException {
        directory.mkdirs();
        Set<String> usedNames = new HashSet<>();
        for (AreaAnalysis analysis : analyses) {
            File file = new File(directory, uniqueFileName(analysis.areaId, usedNames) + "." + extension());
            try (OutputStream out = new FileOutputStream(file)) {
                render(analysis, out);
            }
        }
        LOG.info("Wrote {} chart files to {}", analyses.size(), directory);
    }

    ObjectNode toJson (AreaAnalysis analysis) {
        CleanedSeries cleaned = analysis.cleaned;
        DisruptionWindow window = analysis.window;
        ObjectNode root = mapper.createObjectNode();
        root.put("areaId", analysis.areaId);
        root.put("baseline", cleaned.baseline.level);
        root.put("baselineStart", cleaned.baseline.window.start);
        root.put("baselineEnd", cleaned.baseline.window.end);

        ArrayNode curve = root.putArray("curve");
        for (int i = 0; i < cleaned.size(); i++) {
            ObjectNode point = curve.addObject();
            point.put("time", cleaned.time(i));
            point.put("value", cleaned.value(i));
            point.put("deviation", cleaned.deviation(i));
            point.put("filled", cleaned.isFilled(i));
        }

        ObjectNode events = root.putObject("criticalEvents");
        putTime(events, "onset", cleaned, window.onsetIndex);
        putTime(events, "trough", cleaned, window.troughIndex);
        putTime(events, "recovery", cleaned, window.recoveryIndex);

        if (window.isDisrupted()) {
            int end = window.isRecovered() ? window.recoveryIndex : cleaned.lastIndex();
            ArrayNode triangle = root.putArray("triangle");
            triangle.addArray().add(cleaned.time(window.onsetIndex)).add(cleaned.value(window.onsetIndex));
            triangle.addArray().add(cleaned.time(window.troughIndex)).add(cleaned.value(window.troughIndex));
            double endValue = end == window.troughIndex ? cleaned.baseline.valueAt(end) : cleaned.value(end);
            triangle.addArray().add(cleaned.time(end)).add(endValue);
        }
        MetricsRecord auc = analysis.record(ModelType.AUC);
        if (auc != null && MetricsRecord.isDefined(auc.onsetTime)) {
            root.putArray("aucRegion").add(auc.onsetTime)
                    .add(MetricsRecord.isDefined(auc.recoveryTime) ? auc.recoveryTime : cleaned.lastTime());
        }

        ArrayNode metrics = root.putArray("metrics");
        for (MetricsRecord record : analysis.recordList()) {
            ObjectNode node = metrics.addObject();
            node.put("model", record.model.label());
            putDefined(node, "magnitude", record.magnitude);
            putDefined(node, "duration", record.duration);
            putDefined(node, "rapidity", record.rapidity);
            putDefined(node, "recoveryRate", record.recoveryRate);
            putDefined(node, "robustness", record.robustness);
            putDefined(node, "extent", record.extent);
            putDefined(node, "rawArea", record.rawArea);
            node.put("recovered", record.recovered);
        }
        return root;
    }

    private static void putTime (ObjectNode node, String name, CleanedSeries cleaned, int index) {
        if (index == DisruptionWindow.NONE) {
            node.putNull(name);
        } else {
            node.put(name, cleaned.time(index));
        }
    }

    private static void putDefined (ObjectNode node, String name, double value) {
        if (MetricsRecord.isDefined(value)) {
            node.put(name, value);
        } else {
            node.putNull(name);
        }
    }

    static String safeFileName (String areaId) {
        return areaId.replaceAll("[^A-Za-z0-9._-]", "_");
    }

    /**
     * Distinct area IDs can map to the same safe name (a/b and a_b), so later ones get a numeric suffix. Names are
     * compared ignoring case for the benefit of case-insensitive file systems.
     */
    static String uniqueFileName (String areaId, Set<String> usedNames) {
        String base = safeFileName(areaId);
        String name = base;
        for (int n = 2; !usedNames.add(name.toLowerCase(Locale.ROOT)); n++) {
            name = base + "_" + n;
        }
        if (!name.equals(base)) {
            LOG.warn("Chart for area {} written as {} to avoid overwriting another area's chart.", areaId, name);
        }
        return name;
    }
}
