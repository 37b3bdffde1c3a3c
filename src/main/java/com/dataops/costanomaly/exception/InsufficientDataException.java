package com.dataops.costanomaly.exception;

public class InsufficientDataException extends RuntimeException {

    private final int dataPointsAvailable;
    private final int dataPointsRequired;

    public InsufficientDataException(int dataPointsAvailable, int dataPointsRequired) {
        super(String.format("Insufficient data for anomaly detection (minimum %d days required, %d available)",
                dataPointsRequired, dataPointsAvailable));
        this.dataPointsAvailable = dataPointsAvailable;
        this.dataPointsRequired = dataPointsRequired;
    }

    public int getDataPointsAvailable() {
        return dataPointsAvailable;
    }

    public int getDataPointsRequired() {
        return dataPointsRequired;
    }
}
