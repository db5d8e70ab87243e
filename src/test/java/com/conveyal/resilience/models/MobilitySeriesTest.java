package com.conveyal.resilience.models;

import com.conveyal.resilience.ResilienceException;
import org.junit.Test;

import java.util.Arrays;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;
import static org.junit.Assert.assertThrows;

public class MobilitySeriesTest {

    @Test
    public void keepsMissingSamplesExplicit () {
        MobilitySeries series = new MobilitySeries(Arrays.asList(
                new TimePoint(0, 10), TimePoint.missing(1), new TimePoint(2, 12)));
        assertThat(series.size(), is(3));
        assertThat(series.missingCount(), is(1));
        assertThat(series.isMissing(1), is(true));
    }

    @Test
    public void rejectsTimesThatDoNotIncrease () {
        ResilienceException e = assertThrows(ResilienceException.class, () -> new MobilitySeries(Arrays.asList(
                new TimePoint(0, 10), new TimePoint(2, 11), new TimePoint(2, 12))));
        assertThat(e.type, is(ResilienceException.TYPE.BAD_DATA));
    }

    @Test
    public void disruptionWindowEnforcesOrdering () {
        assertThrows(IllegalArgumentException.class, () -> new DisruptionWindow(5, 4, DisruptionWindow.NONE));
        assertThrows(IllegalArgumentException.class, () -> new DisruptionWindow(5, 7, 7));
        assertThrows(IllegalArgumentException.class, () -> new DisruptionWindow(DisruptionWindow.NONE, 3, DisruptionWindow.NONE));
        DisruptionWindow unresolved = new DisruptionWindow(5, 5, DisruptionWindow.NONE);
        assertThat(unresolved.isUnresolved(), is(true));
        assertThat(DisruptionWindow.noDisruption().isDisrupted(), is(false));
    }

    @Test
    public void analysisConfigRejectsNonsense () {
        assertThrows(ResilienceException.class, () -> AnalysisConfig.builder().onsetThreshold(0.05).build());
        assertThrows(ResilienceException.class, () -> AnalysisConfig.builder().minDwellForRecovery(0).build());
        assertThrows(ResilienceException.class, () -> AnalysisConfig.builder().smoothingPeriod(0).build());
        assertThrows(ResilienceException.class, () -> new TimeRange(5, 4));
    }
}
