package com.fintech.signals.domain;

import java.time.Instant;
import java.util.Comparator;

/**
 * One closing price of a quote series.
 *
 * @param timestamp time of the quote
 * @param close closing price
 */
public record QuotePoint(Instant timestamp, double close) {

    /** Orders points oldest first. */
    public static final Comparator<QuotePoint> BY_TIMESTAMP = Comparator.comparing(QuotePoint::timestamp);
}
