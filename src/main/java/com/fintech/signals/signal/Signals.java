package com.fintech.signals.signal;

import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Stateless statistics over a series of closing prices.
 * All functions treat the series as read-only and accept an empty series.
 */
public final class Signals {

    private Signals() {
    }

    /**
     * Absolute and relative difference between the first and last value.
     * A first value of 0 is replaced by 1 as the denominator.
     *
     * @return empty for an empty series
     */
    public static Optional<PriceDifference> priceDifference(double[] series) {
        if (series.length == 0) {
            return Optional.empty();
        }
        double first = series[0];
        double last = series[series.length - 1];
        double absolute = last - first;
        double denominator = first == 0.0 ? 1.0 : first;
        return Optional.of(new PriceDifference(absolute, absolute / denominator));
    }

    /** Lowest value, empty for an empty series. */
    public static OptionalDouble minPrice(double[] series) {
        if (series.length == 0) {
            return OptionalDouble.empty();
        }
        double min = Double.MAX_VALUE;
        for (double value : series) {
            min = Math.min(min, value);
        }
        return OptionalDouble.of(min);
    }

    /** Highest value, empty for an empty series. */
    public static OptionalDouble maxPrice(double[] series) {
        if (series.length == 0) {
            return OptionalDouble.empty();
        }
        double max = -Double.MAX_VALUE;
        for (double value : series) {
            max = Math.max(max, value);
        }
        return OptionalDouble.of(max);
    }

    /**
     * Simple moving average over every contiguous window of {@code windowSize} values.
     *
     * @return {@code series.length - windowSize + 1} averages, or an empty array
     *         when {@code windowSize <= 1} or the series is shorter than the window
     */
    public static double[] windowedSma(double[] series, int windowSize) {
        if (windowSize <= 1 || series.length < windowSize) {
            return new double[0];
        }
        double[] averages = new double[series.length - windowSize + 1];
        for (int start = 0; start < averages.length; start++) {
            double sum = 0.0;
            for (int i = start; i < start + windowSize; i++) {
                sum += series[i];
            }
            averages[start] = sum / windowSize;
        }
        return averages;
    }

    /** Last element of a series, or {@code fallback} when it is empty. */
    public static double lastOrDefault(double[] series, double fallback) {
        return series.length == 0 ? fallback : series[series.length - 1];
    }
}
