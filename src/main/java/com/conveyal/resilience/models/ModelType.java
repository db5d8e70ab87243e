package com.conveyal.resilience.models;

/** The two recovery models. The lower-case name is what appears in exported tables. */
public enum ModelType {
    TRIANGLE,
    AUC;

    public String label () {
        return name().toLowerCase();
    }

    public static ModelType fromLabel (String label) {
        return ModelType.valueOf(label.trim().toUpperCase());
    }
}
