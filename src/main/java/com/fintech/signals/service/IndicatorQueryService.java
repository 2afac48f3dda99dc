package com.fintech.signals.service;

import com.fintech.signals.config.SignalProperties;
import com.fintech.signals.domain.BufferDataRequest;
import com.fintech.signals.domain.PerformanceIndicators;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Read side of the pipeline: fetches snapshots from the buffer sink.
 *
 * Responsibilities:
 * - Input validation
 * - Bounded wait for the buffer sink's reply
 * - Translating delivery and handler failures into {@link ServiceException}
 */
@Service
public class IndicatorQueryService {

    private static final Logger log = LoggerFactory.getLogger(IndicatorQueryService.class);

    private final SignalPipeline pipeline;
    private final Duration timeout;

    private final AtomicLong validationErrors = new AtomicLong(0);
    private final AtomicLong serviceErrors = new AtomicLong(0);

    public IndicatorQueryService(SignalPipeline pipeline, SignalProperties properties, MeterRegistry meterRegistry) {
        this.pipeline = pipeline;
        this.timeout = properties.getQuery().getTimeout();

        meterRegistry.gauge("query.validation.errors", validationErrors);
        meterRegistry.gauge("query.errors", serviceErrors);
    }

    /**
     * Returns up to {@code n} of the most recent indicators, newest first.
     *
     * @throws ValidationException if n is negative
     * @throws ServiceException if the buffer sink does not answer in time
     */
    public List<PerformanceIndicators> tail(int n) {
        if (n < 0) {
            validationErrors.incrementAndGet();
            throw new ValidationException("Entry count must not be negative, got " + n);
        }

        try {
            List<PerformanceIndicators> entries = pipeline.bufferSink()
                .<List<PerformanceIndicators>>ask(new BufferDataRequest(n))
                .get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            log.debug("Tail query: n={}, results={}", n, entries.size());
            return entries;

        } catch (TimeoutException e) {
            serviceErrors.incrementAndGet();
            log.error("Buffer sink did not answer within {}", timeout);
            throw new ServiceException("Indicator buffer did not answer in time", e);

        } catch (ExecutionException e) {
            serviceErrors.incrementAndGet();
            log.error("Buffer query failed: n={}", n, e.getCause());
            throw new ServiceException("Indicator buffer is unavailable", e.getCause());

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ServiceException("Interrupted while querying indicator buffer", e);
        }
    }

    /**
     * Business logic validation exception.
     */
    public static class ValidationException extends RuntimeException {
        public ValidationException(String message) {
            super(message);
        }
    }

    /**
     * Service layer exception (wraps mailbox/actor failures).
     */
    public static class ServiceException extends RuntimeException {
        public ServiceException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
