package com.fintech.signals.sink;

import com.fintech.signals.actor.ActorContext;
import com.fintech.signals.actor.ActorRef;
import com.fintech.signals.actor.MessageBus;
import com.fintech.signals.domain.PerformanceIndicators;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;

@DisplayName("FileSink Tests")
class FileSinkTest {

    private static final Instant START = Instant.parse("2024-01-01T00:00:00Z");

    @TempDir
    Path tempDir;

    private Clock clock;
    private MessageBus bus;
    private ActorContext context;

    @BeforeEach
    void setUp() {
        clock = Clock.fixed(START, ZoneOffset.UTC);
        bus = new MessageBus(new SimpleMeterRegistry());
        ActorRef self = mock(ActorRef.class);
        context = new ActorContext(self, self, bus);
    }

    private PerformanceIndicators indicators(String symbol, double price) {
        return new PerformanceIndicators(symbol, Instant.parse("2024-01-03T00:00:00Z"), price, -0.1, 9.0, 12.0, 0.0);
    }

    @Test
    @DisplayName("Should create <epochSeconds>.csv with the header on start")
    void testHeaderOnStart() throws IOException {
        FileSink sink = new FileSink(tempDir, clock);

        sink.preStart(context);

        assertThat(sink.getFile()).isEqualTo(tempDir.resolve(START.getEpochSecond() + ".csv"));
        assertThat(Files.readAllLines(sink.getFile())).containsExactly(IndicatorCsvFormat.HEADER);
        assertThat(bus.subscriberCount(PerformanceIndicators.class)).isEqualTo(1);
        sink.postStop();
    }

    @Test
    @DisplayName("Should append one flushed row per record")
    void testAppendRows() throws IOException {
        FileSink sink = new FileSink(tempDir, clock);
        sink.preStart(context);

        sink.receive(indicators("AAPL", 9.0));
        sink.receive(indicators("MSFT", 11.5));

        // Visible before close
        assertThat(Files.readAllLines(sink.getFile())).containsExactly(
            IndicatorCsvFormat.HEADER,
            "2024-01-03T00:00:00Z,AAPL,$9.00,-10.00%,$9.00,$12.00,$0.00",
            "2024-01-03T00:00:00Z,MSFT,$11.50,-10.00%,$9.00,$12.00,$0.00");
        assertThat(sink.getRowsWritten()).isEqualTo(2);
        sink.postStop();
    }

    @Test
    @DisplayName("Should never overwrite an existing log")
    void testUniqueFileNames() throws IOException {
        FileSink first = new FileSink(tempDir, clock);
        first.preStart(context);
        first.receive(indicators("AAPL", 9.0));
        first.postStop();

        // Same second, as after an immediate restart
        FileSink second = new FileSink(tempDir, clock);
        second.preStart(context);
        second.postStop();

        assertThat(second.getFile().getFileName().toString()).isEqualTo(START.getEpochSecond() + "-1.csv");
        assertThat(Files.readAllLines(first.getFile())).hasSize(2);
    }

    @Test
    @DisplayName("Should create the output directory")
    void testCreatesDirectory() throws IOException {
        Path nested = tempDir.resolve("logs/signals");
        FileSink sink = new FileSink(nested, clock);

        sink.preStart(context);
        sink.postStop();

        assertThat(Files.isDirectory(nested)).isTrue();
        assertThat(Files.exists(sink.getFile())).isTrue();
    }

    @Test
    @DisplayName("Should fail to start when the output directory cannot be created")
    void testStartFailure() throws IOException {
        Path blocker = Files.createFile(tempDir.resolve("not-a-dir"));
        FileSink sink = new FileSink(blocker, clock);

        assertThatThrownBy(() -> sink.preStart(context)).isInstanceOf(IOException.class);
        assertThat(bus.subscriberCount(PerformanceIndicators.class)).isZero();
    }

    @Test
    @DisplayName("Should tolerate stop without start")
    void testStopWithoutStart() throws IOException {
        new FileSink(tempDir, clock).postStop();
    }
}
