package com.conveyal.resilience.data;

import com.conveyal.resilience.ResilienceException;
import com.conveyal.resilience.models.AreaSeries;
import com.conveyal.resilience.models.MobilitySeries;
import org.junit.Test;

import java.io.IOException;
import java.io.StringReader;
import java.time.LocalDate;
import java.util.List;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.closeTo;
import static org.hamcrest.Matchers.is;
import static org.junit.Assert.assertThrows;

public class CsvMobilityDataSourceTest {

    private static CsvMobilityDataSource source () {
        return new CsvMobilityDataSource(new CsvMobilityDataSource.Config() {
            @Override public String inputFile () { return "unused.csv"; }
            @Override public String areaColumn () { return "destination_cbg"; }
            @Override public String timeColumn () { return "date"; }
            @Override public String valueColumn () { return "destination_device_count"; }
        });
    }

    @Test
    public void sumsRowsPerAreaAndDateAndFillsMissingDays () throws IOException {
        String csv = "origin_cbg,destination_cbg,date,destination_device_count\n" +
                "o1,b,2019-09-01,4\n" +
                "o1,a,2019-09-01,10\n" +
                "o2,a,2019-09-01,5\n" +
                "o1,a,2019-09-02,NA\n" +
                "o1,a,2019-09-04,7\n" +
                "o1,b,2019-09-02,3\n";
        CsvMobilityDataSource source = source();
        List<AreaSeries> areas = source.load(new StringReader(csv));
        assertThat(source.usesDates(), is(true));
        assertThat(areas.size(), is(2));
        assertThat(areas.get(0).areaId, is("a"));
        assertThat(areas.get(1).areaId, is("b"));

        MobilitySeries a = areas.get(0).series;
        assertThat(a.size(), is(4));
        assertThat(a.time(0), is((double) LocalDate.of(2019, 9, 1).toEpochDay()));
        assertThat(a.value(0), closeTo(15, 1e-12));
        assertThat(a.isMissing(1), is(true));
        // 2019-09-03 is absent from the file altogether.
        assertThat(a.isMissing(2), is(true));
        assertThat(a.value(3), closeTo(7, 1e-12));
    }

    @Test
    public void readsNumericTimesWithoutAddingSamples () throws IOException {
        String csv = "destination_cbg,date,destination_device_count\n" +
                "a,0,10\n" +
                "a,2.5,\n" +
                "a,7,12\n";
        CsvMobilityDataSource source = source();
        MobilitySeries a = source.load(new StringReader(csv)).get(0).series;
        assertThat(source.usesDates(), is(false));
        assertThat(a.size(), is(3));
        assertThat(a.time(1), is(2.5));
        assertThat(a.isMissing(1), is(true));
    }

    @Test
    public void valuePresentInAnyRowWins () throws IOException {
        String csv = "destination_cbg,date,destination_device_count\n" +
                "a,1,NaN\n" +
                "a,1,6\n";
        MobilitySeries a = source().load(new StringReader(csv)).get(0).series;
        assertThat(a.value(0), closeTo(6, 1e-12));
    }

    @Test
    public void rejectsMissingColumn () {
        String csv = "area,date,destination_device_count\na,1,3\n";
        ResilienceException e = assertThrows(ResilienceException.class,
                () -> source().load(new StringReader(csv)));
        assertThat(e.type, is(ResilienceException.TYPE.BAD_DATA));
    }

    @Test
    public void rejectsUnreadableValues () {
        String csv = "destination_cbg,date,destination_device_count\na,1,many\n";
        assertThrows(ResilienceException.class, () -> source().load(new StringReader(csv)));
    }

    @Test
    public void rejectsMixedTimeFormats () {
        String csv = "destination_cbg,date,destination_device_count\na,2019-09-01,3\na,5,4\n";
        assertThrows(ResilienceException.class, () -> source().load(new StringReader(csv)));
    }

    @Test
    public void timeFormatIsDecidedPerLoad () throws IOException {
        CsvMobilityDataSource source = source();
        source.load(new StringReader("destination_cbg,date,destination_device_count\na,2019-09-01,3\n"));
        assertThat(source.usesDates(), is(true));
        List<AreaSeries> areas = source.load(new StringReader(
                "destination_cbg,date,destination_device_count\na,0,3\na,1,4\n"));
        assertThat(source.usesDates(), is(false));
        assertThat(areas.get(0).series.size(), is(2));
    }
}
