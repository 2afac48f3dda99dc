package com.fintech.signals.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.List;

/**
 * Externalized configuration for the signal pipeline.
 * Maps to 'signals.*' properties in application.yml.
 */
@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "signals")
public class SignalProperties {

    /** Tracked ticker symbols. */
    @NotEmpty
    private List<String> symbols = List.of("AAPL", "MSFT", "UBER", "GOOG");

    /** Start of every fetched period, RFC 3339 (e.g. 2024-01-01T00:00:00Z). Required. */
    private String from;

    /** Market data source: "yahoo" or "simulated". */
    private String provider = "yahoo";

    private Schedule schedule = new Schedule();
    @Valid
    private Downloader downloader = new Downloader();
    private Processor processor = new Processor();
    private FileSink fileSink = new FileSink();
    @Valid
    private Buffer buffer = new Buffer();
    private Query query = new Query();
    private Mailbox mailbox = new Mailbox();
    private Yahoo yahoo = new Yahoo();

    @Data
    public static class Schedule {
        private long intervalMs = 30_000L;
        private long initialDelayMs = 0L;
    }

    @Data
    public static class Downloader {
        @Min(1)
        private int workers = 4;  // Caps concurrent downloads
        private Duration timeout = Duration.ofSeconds(20);
    }

    @Data
    public static class Processor {
        private int smaWindow = 30;
    }

    @Data
    public static class FileSink {
        private String outputDir = ".";
    }

    @Data
    public static class Buffer {
        @Min(1)
        private int capacity = 50;
    }

    @Data
    public static class Query {
        private Duration timeout = Duration.ofSeconds(2);
    }

    @Data
    public static class Mailbox {
        private int bufferSize = 1024;  // Must be a power of 2
        private String waitStrategy = "BLOCKING";
    }

    @Data
    public static class Yahoo {
        private String baseUrl = "https://query1.finance.yahoo.com";
        private Duration connectTimeout = Duration.ofSeconds(5);
        private Duration readTimeout = Duration.ofSeconds(15);
    }
}
