package com.valuationradar.valuation;

/**
 * Descriptive statistics over price arrays. Percentile inputs must be sorted ascending.
 */
public final class PriceStatistics {

    private PriceStatistics() {}

    /**
     * Linear-interpolated percentile: rank = p/100 * (n - 1), blended between the neighbouring values.
     *
     * @param sorted     ascending prices
     * @param percentile 0..100
     * @return 0 for an empty array
     */
    public static double percentile(double[] sorted, double percentile) {
        if (sorted.length == 0) {
            return 0.0;
        }
        if (sorted.length == 1) {
            return sorted[0];
        }
        double index = (percentile / 100.0) * (sorted.length - 1);
        int lower = (int) Math.floor(index);
        int upper = (int) Math.ceil(index);
        if (lower == upper) {
            return sorted[lower];
        }
        double weight = index - lower;
        return sorted[lower] * (1 - weight) + sorted[upper] * weight;
    }

    public static double mean(double[] values) {
        if (values.length == 0) {
            return 0.0;
        }
        double sum = 0.0;
        for (double v : values) {
            sum += v;
        }
        return sum / values.length;
    }

    /** Population standard deviation. */
    public static double standardDeviation(double[] values, double mean) {
        if (values.length == 0) {
            return 0.0;
        }
        double squares = 0.0;
        for (double v : values) {
            double d = v - mean;
            squares += d * d;
        }
        return Math.sqrt(squares / values.length);
    }

    /**
     * stddev / mean; 0 when the array is empty or the mean is 0.
     */
    public static double coefficientOfVariation(double[] values) {
        double mean = mean(values);
        if (values.length == 0 || mean == 0.0) {
            return 0.0;
        }
        return standardDeviation(values, mean) / mean;
    }
}
