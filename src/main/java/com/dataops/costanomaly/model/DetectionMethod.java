package com.dataops.costanomaly.model;

/**
 * Baseline models used by the detector ensemble. Declaration order is the
 * order detectors run in and the order their tags are joined after a merge.
 */
public enum DetectionMethod {
    STATISTICAL_Z_SCORE("statistical_z_score"),
    MOVING_AVERAGE("moving_average"),
    SEASONAL_DAY_OF_WEEK("seasonal_day_of_week");

    public static final String TAG_SEPARATOR = "+";

    private final String tag;

    DetectionMethod(String tag) {
        this.tag = tag;
    }

    public String getTag() {
        return tag;
    }
}
