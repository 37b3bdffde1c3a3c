package com.dataops.costanomaly.exception;

/**
 * The cost feed (time series or per-date breakdown) could not be read.
 */
public class CostFeedException extends RuntimeException {

    public CostFeedException(String message) {
        super(message);
    }

    public CostFeedException(String message, Throwable cause) {
        super(message, cause);
    }
}
