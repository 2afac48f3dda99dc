package com.fintech.signals.config;

import com.fintech.signals.actor.MessageBus;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Spring configuration for core pipeline beans.
 */
@Configuration
public class PipelineConfiguration {

    @Bean
    public MessageBus messageBus(MeterRegistry meterRegistry) {
        return new MessageBus(meterRegistry);
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
