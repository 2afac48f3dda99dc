package com.fintech.signals.config;

import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.config.MeterFilter;
import io.micrometer.core.instrument.distribution.DistributionStatisticConfig;
import org.springframework.boot.actuate.autoconfigure.metrics.MeterRegistryCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Metrics configuration shared by every registry.
 *
 * Timers here measure network fetches (hundreds of milliseconds) and series
 * processing (microseconds), so the SLO buckets span both ranges.
 */
@Configuration
public class MetricsConfiguration {

    @Bean
    public MeterRegistryCustomizer<MeterRegistry> metricsCommonTags() {
        return registry -> {
            registry.config().commonTags(
                "application", "stock-signal-pipeline",
                "environment", getEnvironment()
            );

            registry.config().meterFilter(new MeterFilter() {
                @Override
                public DistributionStatisticConfig configure(Meter.Id id, DistributionStatisticConfig config) {
                    if (id.getType() != Meter.Type.TIMER) {
                        return config;
                    }
                    return DistributionStatisticConfig.builder()
                        .percentiles(0.5, 0.95, 0.99)
                        .percentilePrecision(2)
                        .serviceLevelObjectives(
                            0.0001,   // 100 μs
                            0.001,    // 1 ms
                            0.01,     // 10 ms
                            0.1,      // 100 ms
                            0.5,      // 500 ms
                            1.0,      // 1 s
                            5.0,      // 5 s
                            20.0      // download timeout
                        )
                        .percentilesHistogram(true)
                        .expiry(Duration.ofMinutes(5))
                        .bufferLength(3)
                        .build()
                        .merge(config);
                }
            });
        };
    }

    private String getEnvironment() {
        String env = System.getenv("SPRING_PROFILES_ACTIVE");
        return env != null ? env : "local";
    }
}
