package com.fintech.signals.ingestion;

import com.fintech.signals.actor.Actor;
import com.fintech.signals.actor.ActorContext;
import com.fintech.signals.domain.FetchRequest;
import com.fintech.signals.domain.QuotePoint;
import com.fintech.signals.domain.QuoteSeries;
import com.fintech.signals.service.QuoteService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Worker that turns a {@link FetchRequest} into a {@link QuoteSeries}.
 *
 * <p>Every request produces exactly one series. When the download fails for
 * any reason the series is empty, so one symbol's failure never stops the
 * pipeline or the other symbols.
 */
public class StockDataDownloader implements Actor {

    private static final Logger log = LoggerFactory.getLogger(StockDataDownloader.class);

    private final QuoteService quoteService;
    private ActorContext context;

    public StockDataDownloader(QuoteService quoteService) {
        this.quoteService = quoteService;
    }

    @Override
    public void preStart(ActorContext context) {
        this.context = context;
        context.subscribe(FetchRequest.class);
    }

    @Override
    public Object receive(Object message) {
        if (message instanceof FetchRequest request) {
            context.publish(download(request));
        } else {
            log.warn("Ignoring unexpected message: {}", message);
        }
        return null;
    }

    private QuoteSeries download(FetchRequest request) {
        try {
            List<QuotePoint> points = quoteService.fetchQuotes(request.symbol(), request.from(), request.to());
            QuoteSeries series = new QuoteSeries(request.symbol(), points);
            log.debug("Downloaded {} quotes for {} ({} - {})",
                series.points().size(), request.symbol(), request.from(), request.to());
            return series;
        } catch (MarketDataException e) {
            log.warn("Ignoring market data error for symbol '{}': {}", request.symbol(), e.getMessage());
            return QuoteSeries.empty(request.symbol());
        }
    }
}
