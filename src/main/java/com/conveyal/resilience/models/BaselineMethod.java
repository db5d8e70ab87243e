package com.conveyal.resilience.models;

/** Statistic used to summarize the reference period into a baseline level. */
public enum BaselineMethod {
    MEAN,
    MEDIAN
}
