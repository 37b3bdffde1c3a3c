package com.dataops.costanomaly.engine;

import com.dataops.costanomaly.model.CostSample;

import java.util.List;

/**
 * Mean and sample standard deviation of a set of costs, computed with
 * Welford's online algorithm.
 */
public final class BaselineStats {

    private final int count;
    private final double mean;
    private final double m2;

    private BaselineStats(int count, double mean, double m2) {
        this.count = count;
        this.mean = mean;
        this.m2 = m2;
    }

    public static BaselineStats ofCosts(List<CostSample> samples) {
        return ofCosts(samples, 0, samples.size());
    }

    /**
     * Statistics over {@code samples[fromInclusive, toExclusive)}.
     */
    public static BaselineStats ofCosts(List<CostSample> samples, int fromInclusive, int toExclusive) {
        int n = 0;
        double mean = 0.0;
        double m2 = 0.0;
        for (int i = fromInclusive; i < toExclusive; i++) {
            double x = samples.get(i).getCost();
            n++;
            double delta = x - mean;
            mean += delta / n;
            double delta2 = x - mean;
            m2 += delta * delta2;
        }
        return new BaselineStats(n, mean, m2);
    }

    public static BaselineStats ofValues(List<Double> values) {
        int n = 0;
        double mean = 0.0;
        double m2 = 0.0;
        for (double x : values) {
            n++;
            double delta = x - mean;
            mean += delta / n;
            double delta2 = x - mean;
            m2 += delta * delta2;
        }
        return new BaselineStats(n, mean, m2);
    }

    public int getCount() {
        return count;
    }

    public double getMean() {
        return mean;
    }

    /**
     * Sample (n - 1) standard deviation; 0 for fewer than two values.
     */
    public double getStdDev() {
        if (count < 2) {
            return 0.0;
        }
        return Math.sqrt(m2 / (count - 1));
    }

    /**
     * Coefficient of variation (stdev / mean); 0 when the mean is not positive.
     */
    public double getCoefficientOfVariation() {
        return mean > 0 ? getStdDev() / mean : 0.0;
    }
}
