package com.fintech.signals.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * OpenAPI/Swagger configuration for API documentation.
 *
 * Access the interactive API documentation at:
 * - Swagger UI: http://localhost:4321/swagger-ui/index.html
 * - OpenAPI JSON: http://localhost:4321/v3/api-docs
 */
@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI signalPipelineOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Stock Signal Pipeline API")
                        .description("""
                                Periodically downloads daily closing prices for a set of tickers \
                                and derives performance indicators from them.

                                **Indicators per symbol:**
                                - Latest close price
                                - Change over the period (%)
                                - Period minimum and maximum
                                - Last 30-day simple moving average

                                The most recent indicators are kept in memory and served by `/tail/{n}`.
                                """)
                        .version("1.0.0"))
                .servers(List.of(
                        new Server()
                                .url("http://localhost:4321")
                                .description("Local Server")
                ));
    }
}
