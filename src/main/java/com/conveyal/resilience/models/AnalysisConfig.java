package com.conveyal.resilience.models;

import com.conveyal.resilience.ResilienceException;

/**
 * Every tunable of the recovery computation, passed explicitly into each call. Immutable; use {@link #builder()}
 * to make one and {@link #toBuilder()} to derive a variant.
 */
public final class AnalysisConfig {

    public static final int NO_LOOKAHEAD_LIMIT = 0;

    /**
     * Reference period for the baseline. When null, the baseline is taken from the first
     * {@link #minBaselinePoints} samples of each series.
     */
    public final TimeRange baselineWindow;

    public final GapPolicy gapPolicy;

    public final BaselineMethod baselineMethod;

    /** Fewest observed samples the baseline window must hold. */
    public final int minBaselinePoints;

    /** Negative fraction of the baseline; relative deviations below it count as disrupted. */
    public final double onsetThreshold;

    /** Consecutive samples that must stay within the threshold for a recovery to count. */
    public final int minDwellForRecovery;

    /** Samples after the onset searched for the trough, or NO_LOOKAHEAD_LIMIT to search to the end. */
    public final int maxLookahead;

    /** Integration window for the AUC model. When null the located onset to recovery span is used. */
    public final TimeRange fixedAucWindow;

    /** Width in samples of the centered rolling mean applied after gap handling. One disables smoothing. */
    public final int smoothingPeriod;

    /** Whether a series with no detectable disruption is an error rather than a zero result. */
    public final boolean requireDisruption;

    private AnalysisConfig (Builder b) {
        if (!(b.onsetThreshold < 0) || b.onsetThreshold <= -1) {
            throw ResilienceException.BadConfig("Onset threshold must be a fraction in (-1, 0), got " + b.onsetThreshold);
        }
        if (b.minDwellForRecovery < 1) {
            throw ResilienceException.BadConfig("Minimum recovery dwell must be at least one sample.");
        }
        if (b.minBaselinePoints < 1) {
            throw ResilienceException.BadConfig("Minimum baseline points must be at least one.");
        }
        if (b.maxLookahead < 0) {
            throw ResilienceException.BadConfig("Maximum look-ahead cannot be negative.");
        }
        if (b.smoothingPeriod < 1) {
            throw ResilienceException.BadConfig("Smoothing period must be at least one sample.");
        }
        if (b.gapPolicy == null || b.baselineMethod == null) {
            throw ResilienceException.BadConfig("Gap policy and baseline method are required.");
        }
        this.baselineWindow = b.baselineWindow;
        this.gapPolicy = b.gapPolicy;
        this.baselineMethod = b.baselineMethod;
        this.minBaselinePoints = b.minBaselinePoints;
        this.onsetThreshold = b.onsetThreshold;
        this.minDwellForRecovery = b.minDwellForRecovery;
        this.maxLookahead = b.maxLookahead;
        this.fixedAucWindow = b.fixedAucWindow;
        this.smoothingPeriod = b.smoothingPeriod;
        this.requireDisruption = b.requireDisruption;
    }

    public static AnalysisConfig defaults () {
        return builder().build();
    }

    public static Builder builder () {
        return new Builder();
    }

    public Builder toBuilder () {
        return new Builder()
                .baselineWindow(baselineWindow)
                .gapPolicy(gapPolicy)
                .baselineMethod(baselineMethod)
                .minBaselinePoints(minBaselinePoints)
                .onsetThreshold(onsetThreshold)
                .minDwellForRecovery(minDwellForRecovery)
                .maxLookahead(maxLookahead)
                .fixedAucWindow(fixedAucWindow)
                .smoothingPeriod(smoothingPeriod)
                .requireDisruption(requireDisruption);
    }

    @Override
    public String toString () {
        return "AnalysisConfig{" +
                "baselineWindow=" + baselineWindow +
                ", gapPolicy=" + gapPolicy +
                ", baselineMethod=" + baselineMethod +
                ", minBaselinePoints=" + minBaselinePoints +
                ", onsetThreshold=" + onsetThreshold +
                ", minDwellForRecovery=" + minDwellForRecovery +
                ", maxLookahead=" + maxLookahead +
                ", fixedAucWindow=" + fixedAucWindow +
                ", smoothingPeriod=" + smoothingPeriod +
                ", requireDisruption=" + requireDisruption +
                '}';
    }

    public static class Builder {
        private TimeRange baselineWindow;
        private GapPolicy gapPolicy = GapPolicy.INTERPOLATE;
        private BaselineMethod baselineMethod = BaselineMethod.MEAN;
        // One week of daily samples.
        private int minBaselinePoints = 7;
        private double onsetThreshold = -0.05;
        private int minDwellForRecovery = 1;
        private int maxLookahead = NO_LOOKAHEAD_LIMIT;
        private TimeRange fixedAucWindow;
        private int smoothingPeriod = 1;
        private boolean requireDisruption = false;

        private Builder () { }

        public Builder baselineWindow (TimeRange baselineWindow) { this.baselineWindow = baselineWindow; return this; }
        public Builder gapPolicy (GapPolicy gapPolicy) { this.gapPolicy = gapPolicy; return this; }
        public Builder baselineMethod (BaselineMethod baselineMethod) { this.baselineMethod = baselineMethod; return this; }
        public Builder minBaselinePoints (int minBaselinePoints) { this.minBaselinePoints = minBaselinePoints; return this; }
        public Builder onsetThreshold (double onsetThreshold) { this.onsetThreshold = onsetThreshold; return this; }
        public Builder minDwellForRecovery (int minDwellForRecovery) { this.minDwellForRecovery = minDwellForRecovery; return this; }
        public Builder maxLookahead (int maxLookahead) { this.maxLookahead = maxLookahead; return this; }
        public Builder fixedAucWindow (TimeRange fixedAucWindow) { this.fixedAucWindow = fixedAucWindow; return this; }
        public Builder smoothingPeriod (int smoothingPeriod) { this.smoothingPeriod = smoothingPeriod; return this; }
        public Builder requireDisruption (boolean requireDisruption) { this.requireDisruption = requireDisruption; return this; }

        public AnalysisConfig build () {
            return new AnalysisConfig(this);
        }
    }
}
