package com.fintech.signals.signal;

/**
 * Change between the first and last value of a series.
 *
 * @param absolute last minus first
 * @param relative absolute change divided by the first value (1 when the first value is 0)
 */
public record PriceDifference(double absolute, double relative) {}
