package com.fintech.signals.ingestion;

import com.fasterxml.jackson.databind.JsonNode;
import com.fintech.signals.config.SignalProperties;
import com.fintech.signals.domain.QuotePoint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.HttpHeaders;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Daily closing prices from the Yahoo Finance chart API.
 *
 * <p>Reads {@code chart.result[0].timestamp[]} and
 * {@code chart.result[0].indicators.quote[0].close[]}; days without a close
 * (null entries) are skipped.
 */
@Component
@ConditionalOnProperty(name = "signals.provider", havingValue = "yahoo", matchIfMissing = true)
public class YahooFinanceProvider implements MarketDataProvider {

    private static final Logger log = LoggerFactory.getLogger(YahooFinanceProvider.class);

    private static final String CHART_PATH = "/v8/finance/chart/{symbol}?period1={from}&period2={to}&interval=1d";

    private final RestClient http;

    public YahooFinanceProvider(RestClient.Builder builder, SignalProperties properties) {
        SignalProperties.Yahoo yahoo = properties.getYahoo();

        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout((int) yahoo.getConnectTimeout().toMillis());
        requestFactory.setReadTimeout((int) yahoo.getReadTimeout().toMillis());

        // Browser-like headers; the API rejects requests without a user agent
        this.http = builder
            .baseUrl(yahoo.getBaseUrl())
            .requestFactory(requestFactory)
            .defaultHeader(HttpHeaders.USER_AGENT, "Mozilla/5.0 (X11; Linux x86_64) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/125.0.0.0 Safari/537.36")
            .defaultHeader(HttpHeaders.ACCEPT, "application/json")
            .build();
    }

    @Override
    public List<QuotePoint> fetch(String symbol, Instant from, Instant to) {
        JsonNode response;
        try {
            response = http.get()
                .uri(CHART_PATH, symbol, from.getEpochSecond(), to.getEpochSecond())
                .retrieve()
                .body(JsonNode.class);
        } catch (RestClientException e) {
            throw new MarketDataException("Chart request failed for " + symbol + ": " + e.getMessage(), e);
        }

        if (response == null) {
            throw new MarketDataException("Empty chart response for " + symbol);
        }
        List<QuotePoint> points = parseChart(symbol, response);
        log.debug("Fetched {} quotes for {}", points.size(), symbol);
        return points;
    }

    /**
     * Extracts closing prices from a chart response body.
     */
    static List<QuotePoint> parseChart(String symbol, JsonNode root) {
        JsonNode chart = root.path("chart");
        JsonNode results = chart.path("result");
        if (!results.isArray() || results.isEmpty()) {
            String description = chart.path("error").path("description").asText("no result");
            throw new MarketDataException("No chart data for " + symbol + ": " + description);
        }

        JsonNode result = results.get(0);
        JsonNode timestamps = result.path("timestamp");
        if (timestamps.isMissingNode() || timestamps.isNull()) {
            // No trading days in the requested period
            return List.of();
        }

        JsonNode closes = result.path("indicators").path("quote").path(0).path("close");
        if (!timestamps.isArray() || !closes.isArray() || timestamps.size() != closes.size()) {
            throw new MarketDataException("Malformed chart data for " + symbol
                + ": timestamp and close arrays do not match");
        }

        List<QuotePoint> points = new ArrayList<>(timestamps.size());
        for (int i = 0; i < timestamps.size(); i++) {
            JsonNode close = closes.get(i);
            if (close == null || !close.isNumber()) {
                continue;
            }
            points.add(new QuotePoint(Instant.ofEpochSecond(timestamps.get(i).asLong()), close.asDouble()));
        }
        return points;
    }
}
