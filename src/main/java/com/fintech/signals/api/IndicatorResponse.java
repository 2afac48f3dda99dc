package com.fintech.signals.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fintech.signals.domain.PerformanceIndicators;
import io.swagger.v3.oas.annotations.media.Schema;

/**
 * JSON view of one {@link PerformanceIndicators} record.
 * The change is a fraction (0.05 is +5%), the timestamp is RFC 3339 in UTC.
 */
@Schema(description = "Performance indicators of one symbol at its latest quote")
public record IndicatorResponse(

    @Schema(description = "Ticker symbol", example = "AAPL")
    @JsonProperty("symbol")
    String symbol,

    @Schema(description = "Time of the latest quote", example = "2024-01-03T00:00:00Z")
    @JsonProperty("timestamp")
    String timestamp,

    @Schema(description = "Latest close price", example = "184.25")
    @JsonProperty("price")
    double price,

    @Schema(description = "Relative change over the period", example = "0.0512")
    @JsonProperty("pct_change")
    double pctChange,

    @Schema(description = "Lowest close in the period", example = "171.21")
    @JsonProperty("period_min")
    double periodMin,

    @Schema(description = "Highest close in the period", example = "198.11")
    @JsonProperty("period_max")
    double periodMax,

    @Schema(description = "Last simple moving average, 0 when the period is too short", example = "189.37")
    @JsonProperty("last_sma")
    double lastSma
) {

    public static IndicatorResponse from(PerformanceIndicators indicators) {
        return new IndicatorResponse(
            indicators.symbol(),
            indicators.timestamp().toString(),
            indicators.price(),
            indicators.pctChange(),
            indicators.periodMin(),
            indicators.periodMax(),
            indicators.lastSma()
        );
    }
}
