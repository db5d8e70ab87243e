package com.conveyal.resilience.analysis;

import com.conveyal.resilience.ResilienceException;
import com.conveyal.resilience.models.AnalysisConfig;
import com.conveyal.resilience.models.CleanedSeries;
import com.conveyal.resilience.models.MetricsRecord;
import com.conveyal.resilience.models.MobilitySeries;
import com.conveyal.resilience.models.ModelType;
import com.conveyal.resilience.models.TimePoint;
import com.conveyal.resilience.models.TimeRange;
import org.junit.Test;

import java.util.ArrayList;
import java.util.List;

import static com.conveyal.resilience.SeriesFixtures.concat;
import static com.conveyal.resilience.SeriesFixtures.flat;
import static com.conveyal.resilience.SeriesFixtures.quietValues;
import static com.conveyal.resilience.SeriesFixtures.triangleValues;
import static com.conveyal.resilience.SeriesFixtures.unrecoveredValues;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.closeTo;
import static org.hamcrest.Matchers.greaterThan;
import static org.hamcrest.Matchers.is;
import static org.junit.Assert.assertThrows;

public class AucModelTest {

    private static final double EPSILON = 1e-9;

    private final SeriesPreprocessor preprocessor = new SeriesPreprocessor();

    private final AucModel model = new AucModel();

    private CleanedSeries prepare (AnalysisConfig config, double... values) {
        return preprocessor.prepare("a", MobilitySeries.ofValues(values), null, config);
    }

    private MetricsRecord compute (AnalysisConfig config, double... values) {
        return model.compute(prepare(config, values), config);
    }

    @Test
    public void integratesAbsoluteDeviationFromOnsetToRecovery () {
        double[] values = triangleValues();
        MetricsRecord record = compute(AnalysisConfig.defaults(), values);
        double expected = 0;
        for (int i = 7; i < 14; i++) {
            expected += (Math.abs(values[i] - 100) + Math.abs(values[i + 1] - 100)) / 2;
        }
        assertThat(record.model, is(ModelType.AUC));
        assertThat(record.extent, greaterThan(0.0));
        assertThat(record.rawArea, closeTo(expected, EPSILON));
        assertThat(record.rawArea, closeTo(120 + 220.0 / 3, EPSILON));
        assertThat(record.extent, closeTo(expected / (100 * 7), EPSILON));
        assertThat(record.duration, closeTo(7, EPSILON));
        assertThat(record.magnitude, closeTo(40, EPSILON));
        assertThat(record.recovered, is(true));
        assertThat(Double.isNaN(record.rapidity), is(true));
    }

    @Test
    public void overshootAddsToLossInsteadOfCancellingIt () {
        AnalysisConfig config = AnalysisConfig.builder().fixedAucWindow(new TimeRange(7, 12)).build();
        MetricsRecord overshoot = compute(config, concat(flat(7), new double[]{60, 60, 100, 140, 140, 100}));
        MetricsRecord mirrored = compute(config, concat(flat(7), new double[]{60, 60, 100, 60, 60, 100}));
        assertThat(overshoot.extent, greaterThan(0.0));
        assertThat(overshoot.extent, closeTo(mirrored.extent, EPSILON));
        assertThat(overshoot.rawArea, closeTo(140, EPSILON));
    }

    @Test
    public void unrecoveredSeriesIntegratesToTheEnd () {
        double[] values = unrecoveredValues();
        MetricsRecord record = compute(AnalysisConfig.defaults(), values);
        assertThat(record.recovered, is(false));
        assertThat(record.duration, closeTo(values.length - 1 - 7, EPSILON));
        // 80, 60, 60, 60, 65, 70, 70 below 100.
        double expected = (20 + 40) / 2.0 + 40 + (40 + 40) / 2.0 + (40 + 35) / 2.0 + (35 + 30) / 2.0 + 30;
        assertThat(record.rawArea, closeTo(expected, EPSILON));
    }

    @Test
    public void quietSeriesHasNoLoss () {
        for (double threshold : new double[]{-0.04, -0.05, -0.2}) {
            AnalysisConfig config = AnalysisConfig.builder().onsetThreshold(threshold).build();
            MetricsRecord record = compute(config, quietValues());
            assertThat(record.extent, is(0.0));
            assertThat(record.magnitude, is(0.0));
            assertThat(record.recovered, is(true));
        }
    }

    @Test
    public void irregularSpacingWeightsEachSegmentByItsWidth () {
        List<TimePoint> points = new ArrayList<>();
        for (int i = 0; i < 7; i++) points.add(new TimePoint(i, 100));
        points.add(new TimePoint(7, 50));
        points.add(new TimePoint(10, 50));
        points.add(new TimePoint(11, 100));
        AnalysisConfig config = AnalysisConfig.defaults();
        CleanedSeries cleaned = preprocessor.prepare("a", new MobilitySeries(points), null, config);
        MetricsRecord record = model.compute(cleaned, config);
        // 50 below baseline for three time units, then a one-unit ramp back.
        assertThat(record.rawArea, closeTo(50 * 3 + 25, EPSILON));
        assertThat(record.duration, closeTo(4, EPSILON));
        assertThat(record.extent, closeTo(175.0 / 400, EPSILON));
    }

    @Test
    public void fixedWindowOutsideTheSeriesIsAnError () {
        AnalysisConfig config = AnalysisConfig.builder().fixedAucWindow(new TimeRange(100, 200)).build();
        ResilienceException e = assertThrows(ResilienceException.class,
                () -> compute(config, triangleValues()));
        assertThat(e.type, is(ResilienceException.TYPE.BAD_DATA));
    }
}
