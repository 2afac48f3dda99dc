package com.fintech.signals.domain;

import java.util.List;
import java.util.Objects;

/**
 * Downloaded closing prices of one symbol.
 *
 * <p>An empty series means the download failed or returned nothing; it is a
 * normal message, not an error. Points are not guaranteed to be in time order.
 *
 * @param symbol ticker symbol
 * @param points closing prices, possibly unsorted, possibly empty
 */
public record QuoteSeries(String symbol, List<QuotePoint> points) {

    public QuoteSeries {
        Objects.requireNonNull(symbol, "symbol");
        points = points == null ? List.of() : List.copyOf(points);
    }

    /** Creates the series published when nothing could be downloaded. */
    public static QuoteSeries empty(String symbol) {
        return new QuoteSeries(symbol, List.of());
    }

    public boolean isEmpty() {
        return points.isEmpty();
    }
}
