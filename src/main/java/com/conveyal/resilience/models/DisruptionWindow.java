package com.conveyal.resilience.models;

import java.util.Objects;

/**
 * Indexes into a {@link CleanedSeries} of the start of a disruption, its deepest point, and the return to
 * near-baseline. Absent points are {@link #NONE}. When nothing is disrupted all three are NONE, which is a normal
 * outcome rather than an error.
 */
public final class DisruptionWindow {

    public static final int NONE = -1;

    private static final DisruptionWindow NO_DISRUPTION = new DisruptionWindow(NONE, NONE, NONE);

    public final int onsetIndex;
    public final int troughIndex;
    public final int recoveryIndex;

    public DisruptionWindow (int onsetIndex, int troughIndex, int recoveryIndex) {
        if (onsetIndex == NONE) {
            if (troughIndex != NONE || recoveryIndex != NONE) {
                throw new IllegalArgumentException("A window without an onset cannot have a trough or recovery.");
            }
        } else {
            if (troughIndex < onsetIndex) {
                throw new IllegalArgumentException("Trough " + troughIndex + " precedes onset " + onsetIndex);
            }
            if (recoveryIndex != NONE && recoveryIndex <= troughIndex) {
                throw new IllegalArgumentException("Recovery " + recoveryIndex + " does not follow trough " + troughIndex);
            }
        }
        this.onsetIndex = onsetIndex;
        this.troughIndex = troughIndex;
        this.recoveryIndex = recoveryIndex;
    }

    public static DisruptionWindow noDisruption () {
        return NO_DISRUPTION;
    }

    public boolean isDisrupted () {
        return onsetIndex != NONE;
    }

    public boolean isRecovered () {
        return recoveryIndex != NONE;
    }

    /** A disruption was found but the series ends before it recovers. */
    public boolean isUnresolved () {
        return isDisrupted() && !isRecovered();
    }

    @Override
    public boolean equals (Object o) {
        if (!(o instanceof DisruptionWindow)) return false;
        DisruptionWindow other = (DisruptionWindow) o;
        return onsetIndex == other.onsetIndex && troughIndex == other.troughIndex
                && recoveryIndex == other.recoveryIndex;
    }

    @Override
    public int hashCode () {
        return Objects.hash(onsetIndex, troughIndex, recoveryIndex);
    }

    @Override
    public String toString () {
        if (!isDisrupted()) return "DisruptionWindow{no disruption}";
        return "DisruptionWindow{onset=" + onsetIndex + ", trough=" + troughIndex + ", recovery="
                + (isRecovered() ? recoveryIndex : "NONE") + '}';
    }
}
