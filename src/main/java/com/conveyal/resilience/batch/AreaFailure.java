package com.conveyal.resilience.batch;

import com.conveyal.resilience.ResilienceException;

/** An area whose analysis failed, and why. Other areas of the same batch are unaffected. */
public final class AreaFailure {

    public final String areaId;

    public final ResilienceException.TYPE type;

    public final String message;

    public AreaFailure (String areaId, ResilienceException.TYPE type, String message) {
        this.areaId = areaId;
        this.type = type;
        this.message = message;
    }

    public static AreaFailure of (String areaId, ResilienceException e) {
        return new AreaFailure(areaId, e.type, e.getMessage());
    }

    @Override
    public String toString () {
        return "AreaFailure{" + areaId + ", " + type + ": " + message + '}';
    }
}
