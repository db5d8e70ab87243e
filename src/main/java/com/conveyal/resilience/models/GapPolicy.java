package com.conveyal.resilience.models;

/** How the preprocessor treats samples that have no data. */
public enum GapPolicy {
    /** Fill linearly in time between the nearest observed neighbors. */
    INTERPOLATE,
    /** Leave missing samples out of the cleaned series. */
    DROP,
    /** Refuse any series that has a missing sample. */
    FAIL
}
