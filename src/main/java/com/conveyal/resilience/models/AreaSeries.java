package com.conveyal.resilience.models;

/**
 * What a data source hands to the analysis for one area: its identifier, its series, and optionally a baseline
 * window specific to this area. When the window is null the one in the analysis configuration applies.
 */
public final class AreaSeries {

    public final String areaId;

    public final MobilitySeries series;

    public final TimeRange baselineWindow;

    public AreaSeries (String areaId, MobilitySeries series) {
        this(areaId, series, null);
    }

    public AreaSeries (String areaId, MobilitySeries series, TimeRange baselineWindow) {
        this.areaId = areaId;
        this.series = series;
        this.baselineWindow = baselineWindow;
    }

    @Override
    public String toString () {
        return "AreaSeries{" + areaId + ", " + series.size() + " samples}";
    }
}
