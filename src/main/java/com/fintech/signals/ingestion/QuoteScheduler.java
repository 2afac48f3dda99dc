package com.fintech.signals.ingestion;

import com.fintech.signals.actor.MessageBus;
import com.fintech.signals.config.SignalProperties;
import com.fintech.signals.domain.FetchRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Emits one {@link FetchRequest} per tracked symbol at a fixed rate.
 *
 * <p>Every request covers the configured start instant up to the tick time.
 * Delivery problems are logged by the bus and never stop scheduling; the
 * scheduler keeps no state between ticks, so a failed tick leaves nothing
 * behind for the next one.
 */
@Component
public class QuoteScheduler {

    private static final Logger log = LoggerFactory.getLogger(QuoteScheduler.class);

    private final MessageBus bus;
    private final Clock clock;
    private final List<String> symbols;
    private final Instant from;

    private final AtomicLong ticks = new AtomicLong(0);
    private final AtomicLong requestsPublished = new AtomicLong(0);

    /**
     * @throws IllegalStateException if 'signals.from' is missing or not an RFC 3339 timestamp
     */
    public QuoteScheduler(MessageBus bus, SignalProperties properties, Clock clock) {
        this.bus = bus;
        this.clock = clock;
        this.from = parseFrom(properties.getFrom());
        this.symbols = properties.getSymbols().stream()
            .map(String::trim)
            .filter(symbol -> !symbol.isEmpty())
            .distinct()
            .toList();

        log.info("Tracking {} from {}", symbols, from);
    }

    /**
     * Publishes the fetch requests of one tick.
     * Uses fixed-rate scheduling; the first tick fires once the pipeline is running.
     */
    @Scheduled(
        fixedRateString = "${signals.schedule.interval-ms:30000}",
        initialDelayString = "${signals.schedule.initial-delay-ms:0}")
    public void tick() {
        Instant now = clock.instant();
        ticks.incrementAndGet();

        for (String symbol : symbols) {
            int delivered = bus.publish(new FetchRequest(symbol, from, now));
            if (delivered == 0) {
                log.warn("Fetch request for {} reached no downloader", symbol);
            } else {
                requestsPublished.incrementAndGet();
            }
        }
        log.debug("Tick {}: requested {} symbols up to {}", ticks.get(), symbols.size(), now);
    }

    /**
     * Parses the configured period start. Accepts RFC 3339 timestamps with an offset.
     */
    static Instant parseFrom(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalStateException("Missing start date: set 'signals.from' or pass --from=<RFC 3339 timestamp>");
        }
        try {
            return OffsetDateTime.parse(value.trim()).toInstant();
        } catch (DateTimeParseException e) {
            throw new IllegalStateException("Couldn't parse 'from' date '" + value + "'", e);
        }
    }

    public long getTicks() {
        return ticks.get();
    }

    public long getRequestsPublished() {
        return requestsPublished.get();
    }
}
