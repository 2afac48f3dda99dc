package com.fintech.signals.service;

import com.fintech.signals.config.SignalProperties;
import com.fintech.signals.domain.QuotePoint;
import com.fintech.signals.ingestion.MarketDataException;
import com.fintech.signals.ingestion.MarketDataProvider;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterConfig;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Guarded access to the market data provider.
 *
 * Responsibilities:
 * - Time limit on every provider call (a stalled call is cancelled)
 * - One circuit breaker per symbol, so a failing symbol never blocks the others
 * - Uniform failure type ({@link MarketDataException})
 * - Metrics and logging
 */
@Service
public class QuoteService {

    private static final Logger log = LoggerFactory.getLogger(QuoteService.class);

    private final MarketDataProvider provider;
    private final CircuitBreakerRegistry circuitBreakerRegistry;
    private final TimeLimiter timeLimiter;
    private final Duration timeout;
    private final ExecutorService executor;
    private final MeterRegistry meterRegistry;

    private final AtomicLong fetchErrors = new AtomicLong(0);
    private final AtomicLong fetchTimeouts = new AtomicLong(0);

    public QuoteService(
            MarketDataProvider provider,
            CircuitBreakerRegistry circuitBreakerRegistry,
            SignalProperties properties,
            MeterRegistry meterRegistry) {
        this.provider = provider;
        this.circuitBreakerRegistry = circuitBreakerRegistry;
        this.meterRegistry = meterRegistry;
        this.timeout = properties.getDownloader().getTimeout();
        this.timeLimiter = TimeLimiter.of("market-data", TimeLimiterConfig.custom()
            .timeoutDuration(timeout)
            .cancelRunningFuture(true)
            .build());

        // Calls that outlive their time limit keep their thread until the I/O returns
        AtomicInteger counter = new AtomicInteger(0);
        this.executor = Executors.newCachedThreadPool(runnable -> {
            Thread thread = new Thread(runnable);
            thread.setName("market-data-fetch-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });

        meterRegistry.gauge("quotes.fetch.errors", fetchErrors);
        meterRegistry.gauge("quotes.fetch.timeouts", fetchTimeouts);
    }

    /**
     * Fetches the closing prices of a symbol.
     *
     * @return points as delivered by the provider (unsorted, possibly empty)
     * @throws MarketDataException on provider failure, timeout or open circuit
     */
    public List<QuotePoint> fetchQuotes(String symbol, Instant from, Instant to) {
        CircuitBreaker circuitBreaker = circuitBreakerRegistry.circuitBreaker("market-data-" + symbol);
        Timer.Sample sample = Timer.start(meterRegistry);

        try {
            return circuitBreaker.executeCallable(() -> timeLimiter.executeFutureSupplier(
                () -> CompletableFuture.supplyAsync(() -> checkWellFormed(symbol, provider.fetch(symbol, from, to)), executor)));

        } catch (CallNotPermittedException e) {
            // Circuit breaker is OPEN - fail fast
            throw new MarketDataException("Circuit breaker open for " + symbol, e);

        } catch (TimeoutException e) {
            fetchTimeouts.incrementAndGet();
            throw new MarketDataException("Quote download for " + symbol + " timed out after " + timeout, e);

        } catch (MarketDataException e) {
            fetchErrors.incrementAndGet();
            throw e;

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new MarketDataException("Interrupted while downloading quotes for " + symbol, e);

        } catch (Exception e) {
            fetchErrors.incrementAndGet();
            throw new MarketDataException("Unexpected error downloading quotes for " + symbol, e);

        } finally {
            sample.stop(meterRegistry.timer("quotes.fetch.time", "symbol", symbol));
        }
    }

    /**
     * Rejects a missing list or missing points as malformed provider output.
     */
    static List<QuotePoint> checkWellFormed(String symbol, List<QuotePoint> points) {
        if (points == null) {
            throw new MarketDataException("Provider returned no quote list for " + symbol);
        }
        for (QuotePoint point : points) {
            if (point == null || point.timestamp() == null) {
                throw new MarketDataException("Provider returned a malformed quote for " + symbol);
            }
        }
        return points;
    }

    /**
     * Get circuit breaker state of a symbol for monitoring.
     */
    public String getCircuitBreakerState(String symbol) {
        return circuitBreakerRegistry.circuitBreaker("market-data-" + symbol).getState().name();
    }

    public long getFetchErrors() {
        return fetchErrors.get();
    }

    public long getFetchTimeouts() {
        return fetchTimeouts.get();
    }

    @PreDestroy
    public void shutdown() {
        log.info("Shutting down market data executor");
        executor.shutdownNow();
    }
}
