package com.conveyal.resilience.analysis;

import com.conveyal.resilience.models.AnalysisConfig;
import com.conveyal.resilience.models.CleanedSeries;
import com.conveyal.resilience.models.DisruptionWindow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static com.conveyal.resilience.models.DisruptionWindow.NONE;

/**
 * Finds the onset, trough and recovery of the single disruption in a cleaned series. All thresholds are fractions of
 * the baseline, so the same configuration applies to areas of very different size.
 */
public class DisruptionLocator {

    private static final Logger LOG = LoggerFactory.getLogger(DisruptionLocator.class);

    public DisruptionWindow locate (CleanedSeries cleaned, double onsetThreshold) {
        return locate(cleaned, onsetThreshold, 1, AnalysisConfig.NO_LOOKAHEAD_LIMIT);
    }

    public DisruptionWindow locate (CleanedSeries cleaned, AnalysisConfig config) {
        return locate(cleaned, config.onsetThreshold, config.minDwellForRecovery, config.maxLookahead);
    }

    public DisruptionWindow locate (CleanedSeries cleaned, double onsetThreshold, int minDwell, int maxLookahead) {
        int onset = findOnset(cleaned, onsetThreshold);
        if (onset == NONE) {
            LOG.debug("No disruption below {} in area {}", onsetThreshold, cleaned.areaId);
            return DisruptionWindow.noDisruption();
        }
        int trough = findTrough(cleaned, onset, maxLookahead);
        int recovery = findRecovery(cleaned, trough, onsetThreshold, minDwell);
        DisruptionWindow window = new DisruptionWindow(onset, trough, recovery);
        LOG.debug("Area {}: {}", cleaned.areaId, window);
        return window;
    }

    /**
     * First sample after the baseline window that is below the threshold and whose successor is too. A single sample
     * dipping below and coming straight back is noise, not an onset.
     */
    static int findOnset (CleanedSeries cleaned, double onsetThreshold) {
        for (int i = cleaned.analysisStart; i + 1 < cleaned.size(); i++) {
            if (isBelow(cleaned, i, onsetThreshold) && isBelow(cleaned, i + 1, onsetThreshold)) {
                return i;
            }
        }
        return NONE;
    }

    /** Lowest deviation from the onset onward. Ties go to the earliest sample. */
    static int findTrough (CleanedSeries cleaned, int onset, int maxLookahead) {
        int end = cleaned.lastIndex();
        if (maxLookahead != AnalysisConfig.NO_LOOKAHEAD_LIMIT) {
            end = Math.min(end, onset + maxLookahead);
        }
        int trough = onset;
        for (int i = onset + 1; i <= end; i++) {
            if (cleaned.deviation(i) < cleaned.deviation(trough)) trough = i;
        }
        return trough;
    }

    /**
     * First sample after the trough that is back within the threshold and stays there for minDwell samples in a row.
     * A run cut short by the end of the series is not confirmed.
     */
    static int findRecovery (CleanedSeries cleaned, int trough, double onsetThreshold, int minDwell) {
        int run = 0;
        for (int i = trough + 1; i < cleaned.size(); i++) {
            if (isBelow(cleaned, i, onsetThreshold)) {
                run = 0;
            } else if (++run >= minDwell) {
                return i - minDwell + 1;
            }
        }
        return NONE;
    }

    private static boolean isBelow (CleanedSeries cleaned, int i, double onsetThreshold) {
        return cleaned.relativeDeviation(i) < onsetThreshold;
    }
}
