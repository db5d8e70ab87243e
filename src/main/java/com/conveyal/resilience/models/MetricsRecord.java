package com.conveyal.resilience.models;

import java.util.Objects;

/**
 * Recovery descriptors for one area under one model. This is the unit handed to renderers and written as one row
 * of the exported table.
 *
 * Quantities a model cannot define for a given series hold {@link #UNDEFINED} rather than zero, so a missing recovery
 * rate is never mistaken for an instant recovery.
 */
public final class MetricsRecord {

    public static final double UNDEFINED = Double.NaN;

    public final String areaId;

    public final ModelType model;

    /** Depth of the deepest deviation below baseline, in the units of the indicator. */
    public final double magnitude;

    /** Time from onset to recovery, or to the end of the series when there was no recovery. */
    public final double duration;

    /** Rate of decline from onset to trough, indicator units per time unit. */
    public final double rapidity;

    /** Rate of return from trough to recovery. UNDEFINED when the series did not recover. */
    public final double recoveryRate;

    /** One minus the fraction of the baseline lost at the trough, clamped to [0, 1]. */
    public final double robustness;

    /** Loss normalized by baseline level times window duration, unitless. */
    public final double extent;

    /** The same loss before normalization, in indicator units times time units. */
    public final double rawArea;

    public final boolean recovered;

    /** Times of the located points, UNDEFINED where the point does not exist. */
    public final double onsetTime;
    public final double troughTime;
    public final double recoveryTime;

    private MetricsRecord (Builder builder) {
        this.areaId = builder.areaId;
        this.model = builder.model;
        this.magnitude = builder.magnitude;
        this.duration = builder.duration;
        this.rapidity = builder.rapidity;
        this.recoveryRate = builder.recoveryRate;
        this.robustness = builder.robustness;
        this.extent = builder.extent;
        this.rawArea = builder.rawArea;
        this.recovered = builder.recovered;
        this.onsetTime = builder.onsetTime;
        this.troughTime = builder.troughTime;
        this.recoveryTime = builder.recoveryTime;
    }

    public static Builder builder (String areaId, ModelType model) {
        return new Builder(areaId, model);
    }

    /** The record for a series that never went below the onset threshold: nothing lost, fully recovered. */
    public static MetricsRecord noDisruption (String areaId, ModelType model) {
        return builder(areaId, model)
                .magnitude(0)
                .duration(0)
                .rapidity(0)
                .recoveryRate(0)
                .robustness(1)
                .extent(0)
                .rawArea(0)
                .recovered(true)
                .build();
    }

    public static boolean isDefined (double value) {
        return !Double.isNaN(value);
    }

    @Override
    public boolean equals (Object o) {
        if (this == o) return true;
        if (!(o instanceof MetricsRecord)) return false;
        MetricsRecord other = (MetricsRecord) o;
        return areaId.equals(other.areaId) && model == other.model && recovered == other.recovered
                && Double.compare(magnitude, other.magnitude) == 0
                && Double.compare(duration, other.duration) == 0
                && Double.compare(rapidity, other.rapidity) == 0
                && Double.compare(recoveryRate, other.recoveryRate) == 0
                && Double.compare(robustness, other.robustness) == 0
                && Double.compare(extent, other.extent) == 0
                && Double.compare(rawArea, other.rawArea) == 0
                && Double.compare(onsetTime, other.onsetTime) == 0
                && Double.compare(troughTime, other.troughTime) == 0
                && Double.compare(recoveryTime, other.recoveryTime) == 0;
    }

    @Override
    public int hashCode () {
        return Objects.hash(areaId, model, magnitude, duration, extent, recovered);
    }

    @Override
    public String toString () {
        return "MetricsRecord{" +
                "areaId='" + areaId + '\'' +
                ", model=" + model.label() +
                ", magnitude=" + magnitude +
                ", duration=" + duration +
                ", rapidity=" + rapidity +
                ", recoveryRate=" + recoveryRate +
                ", robustness=" + robustness +
                ", extent=" + extent +
                ", rawArea=" + rawArea +
                ", recovered=" + recovered +
                '}';
    }

    public static class Builder {
        private final String areaId;
        private final ModelType model;
        private double magnitude;
        private double duration;
        private double rapidity = UNDEFINED;
        private double recoveryRate = UNDEFINED;
        private double robustness = UNDEFINED;
        private double extent;
        private double rawArea;
        private boolean recovered;
        private double onsetTime = UNDEFINED;
        private double troughTime = UNDEFINED;
        private double recoveryTime = UNDEFINED;

        private Builder (String areaId, ModelType model) {
            this.areaId = Objects.requireNonNull(areaId, "areaId");
            this.model = Objects.requireNonNull(model, "model");
        }

        public Builder magnitude (double magnitude) { this.magnitude = magnitude; return this; }
        public Builder duration (double duration) { this.duration = duration; return this; }
        public Builder rapidity (double rapidity) { this.rapidity = rapidity; return this; }
        public Builder recoveryRate (double recoveryRate) { this.recoveryRate = recoveryRate; return this; }
        public Builder robustness (double robustness) { this.robustness = robustness; return this; }
        public Builder extent (double extent) { this.extent = extent; return this; }
        public Builder rawArea (double rawArea) { this.rawArea = rawArea; return this; }
        public Builder recovered (boolean recovered) { this.recovered = recovered; return this; }
        public Builder onsetTime (double onsetTime) { this.onsetTime = onsetTime; return this; }
        public Builder troughTime (double troughTime) { this.troughTime = troughTime; return this; }
        public Builder recoveryTime (double recoveryTime) { this.recoveryTime = recoveryTime; return this; }

        public MetricsRecord build () {
            return new MetricsRecord(this);
        }
    }
}
