package com.fintech.signals.domain;

import java.time.Instant;
import java.util.Objects;

/**
 * Request to download the quote history of one symbol.
 * One is created per symbol on every scheduler tick.
 *
 * @param symbol ticker symbol, e.g. "AAPL"
 * @param from start of the period (inclusive)
 * @param to end of the period, the tick time
 */
public record FetchRequest(String symbol, Instant from, Instant to) {

    public FetchRequest {
        Objects.requireNonNull(symbol, "symbol");
        Objects.requireNonNull(from, "from");
        Objects.requireNonNull(to, "to");
    }
}
