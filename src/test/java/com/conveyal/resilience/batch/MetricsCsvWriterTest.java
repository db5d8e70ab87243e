package com.conveyal.resilience.batch;

import com.conveyal.resilience.ResilienceException;
import com.conveyal.resilience.models.MetricsRecord;
import com.conveyal.resilience.models.ModelType;
import org.junit.Test;

import java.io.IOException;
import java.io.StringWriter;
import java.time.LocalDate;
import java.util.List;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;

public class MetricsCsvWriterTest {

    @Test
    public void writesOneRowPerRecordWithEmptyCellsForUndefinedValues () throws IOException {
        double onset = LocalDate.of(2019, 9, 17).toEpochDay();
        MetricsRecord unresolved = MetricsRecord.builder("48245", ModelType.TRIANGLE)
                .magnitude(40)
                .duration(6)
                .rapidity(40)
                .robustness(0.6)
                .extent(0.25)
                .rawArea(150.5)
                .recovered(false)
                .onsetTime(onset)
                .troughTime(onset + 1)
                .build();
        MetricsRecord quiet = MetricsRecord.noDisruption("48246", ModelType.AUC);

        StringWriter out = new StringWriter();
        new MetricsCsvWriter(true).writeMetrics(List.of(unresolved, quiet), out);
        String[] lines = out.toString().split("\\R");

        assertThat(lines.length, is(3));
        assertThat(lines[0], is("area_id,model,magnitude,duration,rapidity,recovery_rate,robustness," +
                "extent,raw_area,recovered,onset,trough,recovery"));
        assertThat(lines[1], is("48245,triangle,40,6,40,,0.6,0.25,150.5,false,2019-09-17,2019-09-18,"));
        assertThat(lines[2], is("48246,auc,0,0,0,0,1,0,0,true,,,"));
    }

    @Test
    public void writesFailures () throws IOException {
        StringWriter out = new StringWriter();
        new MetricsCsvWriter(false).writeFailures(List.of(new AreaFailure("x",
                ResilienceException.TYPE.INCOMPLETE_SERIES, "gap at 3")), out);
        String[] lines = out.toString().split("\\R");
        assertThat(lines[0], is("area_id,error,message"));
        assertThat(lines[1], is("x,INCOMPLETE_SERIES,gap at 3"));
    }
}
