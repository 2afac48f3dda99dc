package com.fintech.signals.service;

import com.fintech.signals.actor.ActorPool;
import com.fintech.signals.actor.ActorRef;
import com.fintech.signals.actor.ActorSystem;
import com.fintech.signals.actor.MailboxSettings;
import com.fintech.signals.actor.MessageBus;
import com.fintech.signals.config.SignalProperties;
import com.fintech.signals.domain.FetchRequest;
import com.fintech.signals.ingestion.StockDataDownloader;
import com.fintech.signals.processing.StockDataProcessor;
import com.fintech.signals.sink.BufferSink;
import com.fintech.signals.sink.FileSink;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.time.Clock;

/**
 * Builds the supervised workers of the pipeline and ties them to the
 * application lifecycle.
 *
 * <p>Workers start during context refresh, before the web server and before
 * the first scheduler tick, so every subscription is in place when the first
 * fetch request is published. A worker that cannot start (e.g. the log file
 * cannot be created) fails the refresh and the application exits.
 */
@Component
public class SignalPipeline implements SmartLifecycle {

    private static final Logger log = LoggerFactory.getLogger(SignalPipeline.class);

    private final ActorSystem actorSystem;
    private final ActorRef bufferSink;
    private final ActorPool downloaders;

    private volatile boolean running;

    public SignalPipeline(
            MessageBus bus,
            QuoteService quoteService,
            SignalProperties properties,
            MeterRegistry meterRegistry,
            Clock clock) {
        MailboxSettings mailbox = new MailboxSettings(
            properties.getMailbox().getBufferSize(),
            properties.getMailbox().getWaitStrategy());
        this.actorSystem = new ActorSystem(bus, mailbox, meterRegistry);

        Path outputDir = Path.of(properties.getFileSink().getOutputDir());
        int capacity = properties.getBuffer().getCapacity();
        int smaWindow = properties.getProcessor().getSmaWindow();

        // Consumers first: start order is spawn order, stop order is the reverse
        actorSystem.spawn("file-sink", () -> new FileSink(outputDir, clock));
        this.bufferSink = actorSystem.spawn("buffer-sink", () -> new BufferSink(capacity));
        actorSystem.spawn("processor", () -> new StockDataProcessor(smaWindow, meterRegistry));
        this.downloaders = actorSystem.spawnPool(
            "downloader",
            properties.getDownloader().getWorkers(),
            () -> new StockDataDownloader(quoteService),
            message -> message instanceof FetchRequest request ? request.symbol() : null);
    }

    @Override
    public void start() {
        log.info("Starting signal pipeline ({} downloader workers)", downloaders.size());
        actorSystem.start();
        running = true;
    }

    @Override
    public void stop() {
        log.info("Stopping signal pipeline");
        actorSystem.shutdown();
        running = false;
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    /**
     * Starts before the web server and stops after it.
     */
    @Override
    public int getPhase() {
        return 0;
    }

    /** Address of the in-memory indicator buffer. */
    public ActorRef bufferSink() {
        return bufferSink;
    }
}
