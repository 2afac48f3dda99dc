package com.fintech.signals.ingestion;

import com.fintech.signals.actor.ActorContext;
import com.fintech.signals.actor.ActorRef;
import com.fintech.signals.actor.MessageBus;
import com.fintech.signals.config.SignalProperties;
import com.fintech.signals.domain.FetchRequest;
import com.fintech.signals.domain.QuotePoint;
import com.fintech.signals.domain.QuoteSeries;
import com.fintech.signals.service.QuoteService;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Instant;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@DisplayName("StockDataDownloader Tests")
class StockDataDownloaderTest {

    private static final Instant FROM = Instant.parse("2024-01-01T00:00:00Z");
    private static final Instant TO = Instant.parse("2024-01-05T00:00:00Z");

    private QuoteService quoteService;
    private MessageBus bus;
    private ActorRef processor;
    private StockDataDownloader downloader;

    @BeforeEach
    void setUp() {
        quoteService = mock(QuoteService.class);
        bus = new MessageBus(new SimpleMeterRegistry());
        processor = mock(ActorRef.class);
        when(processor.name()).thenReturn("processor");
        when(processor.tell(any())).thenReturn(true);
        bus.subscribe(QuoteSeries.class, processor);

        downloader = new StockDataDownloader(quoteService);
        ActorRef self = mock(ActorRef.class);
        downloader.preStart(new ActorContext(self, self, bus));
    }

    private QuoteSeries publishedSeries() {
        ArgumentCaptor<Object> captor = ArgumentCaptor.forClass(Object.class);
        verify(processor, times(1)).tell(captor.capture());
        return (QuoteSeries) captor.getValue();
    }

    @Test
    @DisplayName("Should subscribe to fetch requests on start")
    void testSubscribes() {
        assertThat(bus.subscriberCount(FetchRequest.class)).isEqualTo(1);
    }

    @Test
    @DisplayName("Should publish the downloaded series")
    void testPublishesSeries() {
        List<QuotePoint> points = List.of(new QuotePoint(FROM, 10.0), new QuotePoint(TO, 11.0));
        when(quoteService.fetchQuotes("AAPL", FROM, TO)).thenReturn(points);

        downloader.receive(new FetchRequest("AAPL", FROM, TO));

        QuoteSeries series = publishedSeries();
        assertThat(series.symbol()).isEqualTo("AAPL");
        assertThat(series.points()).isEqualTo(points);
    }

    @Test
    @DisplayName("Should publish an empty series when the download fails")
    void testFailureBecomesEmptySeries() {
        when(quoteService.fetchQuotes("NOPE", FROM, TO))
            .thenThrow(new MarketDataException("No chart data for NOPE"));

        downloader.receive(new FetchRequest("NOPE", FROM, TO));

        QuoteSeries series = publishedSeries();
        assertThat(series.symbol()).isEqualTo("NOPE");
        assertThat(series.isEmpty()).isTrue();
    }

    @Test
    @DisplayName("Should publish an empty series when the provider returns no list")
    void testNullQuoteList() {
        MarketDataProvider provider = mock(MarketDataProvider.class);
        when(provider.fetch("AAPL", FROM, TO)).thenReturn(null);

        receiveWithRealQuoteService(provider, new FetchRequest("AAPL", FROM, TO));

        QuoteSeries series = publishedSeries();
        assertThat(series.symbol()).isEqualTo("AAPL");
        assertThat(series.isEmpty()).isTrue();
    }

    @Test
    @DisplayName("Should publish an empty series when the provider returns a missing point")
    void testNullQuotePoint() {
        MarketDataProvider provider = mock(MarketDataProvider.class);
        when(provider.fetch("AAPL", FROM, TO)).thenReturn(Arrays.asList(new QuotePoint(FROM, 10.0), null));

        receiveWithRealQuoteService(provider, new FetchRequest("AAPL", FROM, TO));

        QuoteSeries series = publishedSeries();
        assertThat(series.symbol()).isEqualTo("AAPL");
        assertThat(series.isEmpty()).isTrue();
    }

    private void receiveWithRealQuoteService(MarketDataProvider provider, FetchRequest request) {
        QuoteService realService = new QuoteService(
            provider, CircuitBreakerRegistry.ofDefaults(), new SignalProperties(), new SimpleMeterRegistry());
        try {
            StockDataDownloader realDownloader = new StockDataDownloader(realService);
            ActorRef self = mock(ActorRef.class);
            realDownloader.preStart(new ActorContext(self, self, bus));

            realDownloader.receive(request);
        } finally {
            realService.shutdown();
        }
    }
}
