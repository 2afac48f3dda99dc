package com.fintech.signals;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Stock Signal Pipeline
 *
 * Fetches daily quotes for the configured symbols on a fixed schedule and turns
 * them into performance indicators, written to a CSV log and kept in an
 * in-memory buffer that the HTTP API serves.
 *
 * Usage:
 * <pre>
 *   java -jar stock-signal-pipeline.jar --from=2024-01-01T00:00:00Z --symbols=AAPL,MSFT
 * </pre>
 *
 * @since 1.0.0
 */
@SpringBootApplication
@EnableScheduling
public class SignalPipelineApplication {

    public static void main(String[] args) {
        SpringApplication.run(SignalPipelineApplication.class, args);
    }
}
