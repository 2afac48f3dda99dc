package com.fintech.signals.ingestion;

import com.fintech.signals.domain.QuotePoint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Random;

/**
 * Offline market data for demos and tests.
 *
 * <p>Generates one daily close per day of the requested period using a random
 * walk. The walk is seeded from the symbol and period start, so repeated
 * fetches of the same period share their history and only grow at the end.
 *
 * <p>Enable with {@code signals.provider=simulated}.
 */
@Component
@ConditionalOnProperty(name = "signals.provider", havingValue = "simulated")
public class SimulatedMarketDataProvider implements MarketDataProvider {

    private static final Logger log = LoggerFactory.getLogger(SimulatedMarketDataProvider.class);

    // Roughly ten years of trading days
    private static final int MAX_DAYS = 3650;

    // Initial prices for well-known symbols
    private static final Map<String, Double> INITIAL_PRICES = Map.of(
        "AAPL", 185.0,
        "MSFT", 370.0,
        "UBER", 61.0,
        "GOOG", 140.0
    );

    // Daily volatility (as fraction of price)
    private static final Map<String, Double> VOLATILITIES = Map.of(
        "AAPL", 0.015,
        "MSFT", 0.014,
        "UBER", 0.030,
        "GOOG", 0.018
    );

    @Override
    public List<QuotePoint> fetch(String symbol, Instant from, Instant to) {
        Instant start = from.truncatedTo(ChronoUnit.DAYS);
        if (!start.isBefore(to)) {
            return List.of();
        }
        long days = Math.min(Duration.between(start, to).toDays() + 1, MAX_DAYS);

        Random random = new Random(Objects.hash(symbol, start));
        double price = INITIAL_PRICES.getOrDefault(symbol, 100.0);
        double volatility = VOLATILITIES.getOrDefault(symbol, 0.02);

        List<QuotePoint> points = new ArrayList<>((int) days);
        for (int day = 0; day < days; day++) {
            Instant timestamp = start.plus(day, ChronoUnit.DAYS);
            if (timestamp.isAfter(to)) {
                break;
            }
            points.add(new QuotePoint(timestamp, round(price)));
            price = nextPrice(random, price, volatility);
        }

        log.debug("Simulated {} quotes for {}", points.size(), symbol);
        return points;
    }

    /**
     * Random walk step: change = price * volatility * randomValue[-1, 1].
     */
    private double nextPrice(Random random, double currentPrice, double volatility) {
        double maxChange = currentPrice * volatility;
        double change = (random.nextDouble() * 2.0 - 1.0) * maxChange;
        double newPrice = currentPrice + change;

        // Prevent negative prices
        return newPrice < 0 ? currentPrice : newPrice;
    }

    private double round(double price) {
        return Math.round(price * 100.0) / 100.0;
    }
}
