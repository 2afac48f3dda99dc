package com.fintech.signals.sink;

import com.fintech.signals.domain.PerformanceIndicators;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

/**
 * CSV layout of the indicator log.
 *
 * <pre>
 * period start,symbol,price,change %,min,max,30d avg
 * 2024-01-03T00:00:00Z,AAPL,$9.00,-10.00%,$9.00,$12.00,$0.00
 * </pre>
 */
public final class IndicatorCsvFormat {

    public static final String HEADER = "period start,symbol,price,change %,min,max,30d avg";

    private IndicatorCsvFormat() {
    }

    /** Formats one row without line terminator. */
    public static String formatRow(PerformanceIndicators indicators) {
        return String.format(Locale.ROOT, "%s,%s,$%.2f,%.2f%%,$%.2f,$%.2f,$%.2f",
            formatTimestamp(indicators.timestamp()),
            indicators.symbol(),
            indicators.price(),
            indicators.pctChange() * 100.0,
            indicators.periodMin(),
            indicators.periodMax(),
            indicators.lastSma());
    }

    /** RFC 3339 in UTC. */
    public static String formatTimestamp(Instant timestamp) {
        return DateTimeFormatter.ISO_OFFSET_DATE_TIME.format(timestamp.atOffset(ZoneOffset.UTC));
    }
}
