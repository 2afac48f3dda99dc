package com.fintech.signals.ingestion;

import com.fintech.signals.domain.QuotePoint;

import java.time.Instant;
import java.util.List;

/**
 * Source of historical closing prices.
 *
 * <p>Implementations may return points in any order and may return an empty
 * list. Failures are reported by throwing; callers turn them into an empty
 * series.
 */
public interface MarketDataProvider {

    /**
     * Retrieves closing prices of a symbol for a period.
     *
     * @param symbol ticker symbol
     * @param from start of the period
     * @param to end of the period
     * @return closing prices, possibly empty, possibly unsorted
     * @throws MarketDataException if the data cannot be retrieved or read
     */
    List<QuotePoint> fetch(String symbol, Instant from, Instant to);
}
