package com.fintech.signals.processing;

import com.fintech.signals.actor.Actor;
import com.fintech.signals.actor.ActorContext;
import com.fintech.signals.domain.PerformanceIndicators;
import com.fintech.signals.domain.QuotePoint;
import com.fintech.signals.domain.QuoteSeries;
import com.fintech.signals.signal.PriceDifference;
import com.fintech.signals.signal.Signals;
import com.fintech.signals.sink.IndicatorCsvFormat;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Worker that derives {@link PerformanceIndicators} from a {@link QuoteSeries}.
 *
 * <p>An empty series produces nothing. Otherwise the points are sorted oldest
 * first and one indicator record is published, stamped with the latest quote.
 */
public class StockDataProcessor implements Actor {

    private static final Logger log = LoggerFactory.getLogger(StockDataProcessor.class);

    private final int smaWindow;
    private final MeterRegistry meterRegistry;
    private ActorContext context;

    public StockDataProcessor(int smaWindow, MeterRegistry meterRegistry) {
        this.smaWindow = smaWindow;
        this.meterRegistry = meterRegistry;
    }

    @Override
    public void preStart(ActorContext context) {
        this.context = context;
        context.subscribe(QuoteSeries.class);
    }

    @Override
    public Object receive(Object message) {
        if (message instanceof QuoteSeries series) {
            process(series).ifPresent(indicators -> {
                context.publish(indicators);
                meterRegistry.counter("processor.indicators.emitted").increment();
                log.info("{}", IndicatorCsvFormat.formatRow(indicators));
            });
        } else {
            log.warn("Ignoring unexpected message: {}", message);
        }
        return null;
    }

    /**
     * Computes the indicators of a series.
     *
     * @return empty for an empty series
     */
    Optional<PerformanceIndicators> process(QuoteSeries series) {
        if (series.isEmpty()) {
            log.debug("Got nothing for {}", series.symbol());
            return Optional.empty();
        }

        Timer.Sample sample = Timer.start(meterRegistry);
        try {
            // Ensure that the data is sorted by time (asc)
            List<QuotePoint> points = new ArrayList<>(series.points());
            points.sort(QuotePoint.BY_TIMESTAMP);

            double[] closes = points.stream().mapToDouble(QuotePoint::close).toArray();
            QuotePoint latest = points.get(points.size() - 1);

            double pctChange = Signals.priceDifference(closes).map(PriceDifference::relative).orElse(0.0);
            double periodMin = Signals.minPrice(closes).orElse(0.0);
            double periodMax = Signals.maxPrice(closes).orElse(0.0);
            double lastSma = Signals.lastOrDefault(Signals.windowedSma(closes, smaWindow), 0.0);

            return Optional.of(new PerformanceIndicators(
                series.symbol(),
                latest.timestamp(),
                latest.close(),
                pctChange,
                periodMin,
                periodMax,
                lastSma
            ));
        } finally {
            sample.stop(meterRegistry.timer("processor.series.processing.time"));
        }
    }
}
