package com.fintech.signals.api;

import com.fintech.signals.domain.PerformanceIndicators;
import com.fintech.signals.service.IndicatorQueryService;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.ArraySchema;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.constraints.PositiveOrZero;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * REST API for the most recent performance indicators.
 */
@RestController
@Validated
@Tag(name = "Indicators", description = "Recently computed performance indicators")
public class TailController {

    private static final Logger log = LoggerFactory.getLogger(TailController.class);

    private final IndicatorQueryService queryService;
    private final MeterRegistry meterRegistry;

    public TailController(IndicatorQueryService queryService, MeterRegistry meterRegistry) {
        this.queryService = queryService;
        this.meterRegistry = meterRegistry;
    }

    /**
     * GET /tail/{n}
     *
     * @param n maximum number of entries to return
     * @return up to n indicator records, newest first
     */
    @Operation(
        summary = "Get the most recent indicators",
        description = """
            Returns up to `n` of the most recently computed indicator records, newest first.
            The buffer holds a bounded number of records; asking for more (up to 2^63-1) returns all of them.

            **Example Request:**
            ```
            GET /tail/5
            ```
            """
    )
    @ApiResponses(value = {
        @ApiResponse(
            responseCode = "200",
            description = "Indicator records, newest first",
            content = @Content(
                mediaType = "application/json",
                array = @ArraySchema(schema = @Schema(implementation = IndicatorResponse.class))
            )
        ),
        @ApiResponse(
            responseCode = "400",
            description = "n is not a non-negative integer",
            content = @Content(schema = @Schema(implementation = ErrorResponse.class))
        ),
        @ApiResponse(
            responseCode = "503",
            description = "The indicator buffer did not answer",
            content = @Content(schema = @Schema(implementation = ErrorResponse.class))
        )
    })
    @GetMapping(value = "/tail/{n}", produces = "application/json")
    public ResponseEntity<List<IndicatorResponse>> tail(
            @Parameter(description = "Maximum number of records", example = "10")
            @PathVariable("n") @PositiveOrZero long n) {

        Timer.Sample sample = Timer.start(meterRegistry);
        try {
            // Counts beyond int range ask for the whole buffer
            List<PerformanceIndicators> entries = queryService.tail((int) Math.min(n, Integer.MAX_VALUE));
            log.debug("GET /tail/{} -> {} entries", n, entries.size());
            return ResponseEntity.ok(entries.stream().map(IndicatorResponse::from).toList());
        } finally {
            sample.stop(meterRegistry.timer("http.tail.requests"));
        }
    }
}
