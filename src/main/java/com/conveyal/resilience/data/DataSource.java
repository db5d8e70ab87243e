package com.conveyal.resilience.data;

import com.conveyal.resilience.models.AreaSeries;

import java.io.IOException;
import java.util.List;

/**
 * Supplies one series per geographic area. The analysis does not care where the series come from.
 */
public interface DataSource {

    List<AreaSeries> load () throws IOException;

    /** True if times are days since the epoch that were read from calendar dates. */
    boolean usesDates ();
}
