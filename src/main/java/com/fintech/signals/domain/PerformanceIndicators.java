package com.fintech.signals.domain;

import java.time.Instant;
import java.util.Objects;

/**
 * Summary statistics of one quote series.
 *
 * @param symbol ticker symbol
 * @param timestamp time of the latest quote in the series
 * @param price latest closing price
 * @param pctChange change from first to last close as a fraction (-0.1 is -10%)
 * @param periodMin lowest close in the series
 * @param periodMax highest close in the series
 * @param lastSma last simple moving average value, 0 when the series is shorter than the window
 */
public record PerformanceIndicators(
    String symbol,
    Instant timestamp,
    double price,
    double pctChange,
    double periodMin,
    double periodMax,
    double lastSma
) {

    public PerformanceIndicators {
        Objects.requireNonNull(symbol, "symbol");
        Objects.requireNonNull(timestamp, "timestamp");
    }
}
