package com.conveyal.resilience;

import com.conveyal.resilience.models.AnalysisConfig;
import com.conveyal.resilience.models.GapPolicy;
import com.conveyal.resilience.models.ModelType;
import com.conveyal.resilience.models.TimeRange;
import org.junit.Test;

import java.time.LocalDate;
import java.util.Properties;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.nullValue;
import static org.junit.Assert.assertThrows;

public class ResilienceConfigTest {

    private static Properties minimal () {
        Properties properties = new Properties();
        properties.setProperty("input-file", "in.csv");
        properties.setProperty("output-file", "out.csv");
        return properties;
    }

    @Test
    public void appliesDefaults () {
        ResilienceConfig config = new ResilienceConfig(minimal());
        AnalysisConfig analysis = config.analysisConfig();
        assertThat(analysis.gapPolicy, is(GapPolicy.INTERPOLATE));
        assertThat(analysis.baselineWindow, is(nullValue()));
        assertThat(analysis.onsetThreshold, is(-0.05));
        assertThat(config.models(), contains(ModelType.TRIANGLE, ModelType.AUC));
        assertThat(config.areaColumn(), is("area_id"));
        assertThat(config.failuresFile(), is(nullValue()));
    }

    @Test
    public void reportsEveryMissingKey () {
        ResilienceException e = assertThrows(ResilienceException.class, () -> new ResilienceConfig(new Properties()));
        assertThat(e.type, is(ResilienceException.TYPE.BAD_CONFIG));
        assertThat(e.getMessage(), containsString("input-file"));
        assertThat(e.getMessage(), containsString("output-file"));
    }

    @Test
    public void baselineEndsTheDayBeforeTheEvent () {
        Properties properties = minimal();
        properties.setProperty("event-start", "2019-09-17");
        properties.setProperty("baseline-days", "15");
        TimeRange window = new ResilienceConfig(properties).analysisConfig().baselineWindow;
        assertThat(window.start, is((double) LocalDate.of(2019, 9, 2).toEpochDay()));
        assertThat(window.end, is((double) LocalDate.of(2019, 9, 16).toEpochDay()));
    }

    @Test
    public void explicitBaselineWindowWins () {
        Properties properties = minimal();
        properties.setProperty("event-start", "2019-09-17");
        properties.setProperty("baseline-start", "0");
        properties.setProperty("baseline-end", "6");
        properties.setProperty("gap-policy", "fail");
        properties.setProperty("models", "auc");
        ResilienceConfig config = new ResilienceConfig(properties);
        assertThat(config.analysisConfig().baselineWindow, is(new TimeRange(0, 6)));
        assertThat(config.analysisConfig().gapPolicy, is(GapPolicy.FAIL));
        assertThat(config.models(), contains(ModelType.AUC));
    }

    @Test
    public void rejectsInvalidValues () {
        Properties badPolicy = minimal();
        badPolicy.setProperty("gap-policy", "guess");
        assertThrows(ResilienceException.class, () -> new ResilienceConfig(badPolicy));

        Properties badThreshold = minimal();
        badThreshold.setProperty("onset-threshold", "0.1");
        assertThrows(ResilienceException.class, () -> new ResilienceConfig(badThreshold));

        Properties halfWindow = minimal();
        halfWindow.setProperty("fixed-auc-window-start", "3");
        assertThrows(ResilienceException.class, () -> new ResilienceConfig(halfWindow));
    }
}
