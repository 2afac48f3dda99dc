package com.fintech.signals.sink;

import com.fintech.signals.actor.Actor;
import com.fintech.signals.actor.ActorContext;
import com.fintech.signals.domain.PerformanceIndicators;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;

/**
 * Worker that appends every {@link PerformanceIndicators} to a CSV file.
 *
 * <p>Each start creates a new file named after the start time, so a restarted
 * sink never overwrites an earlier log. Rows are flushed one by one; a crash
 * loses at most the row being written. The file is flushed and closed in
 * {@link #postStop()}, which the supervisor calls on normal stop and after a crash.
 */
public class FileSink implements Actor {

    private static final Logger log = LoggerFactory.getLogger(FileSink.class);

    private final Path outputDir;
    private final Clock clock;

    private Path file;
    private BufferedWriter writer;
    private long rowsWritten;
    private long writeErrors;

    public FileSink(Path outputDir, Clock clock) {
        this.outputDir = outputDir;
        this.clock = clock;
    }

    /**
     * @throws IOException if the file cannot be created; fatal when the pipeline starts
     */
    @Override
    public void preStart(ActorContext context) throws IOException {
        Files.createDirectories(outputDir);
        file = createUniqueFile(clock.instant().getEpochSecond());
        writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8, StandardOpenOption.WRITE);
        writer.write(IndicatorCsvFormat.HEADER);
        writer.newLine();
        writer.flush();

        log.info("Writing indicators to {}", file.toAbsolutePath());
        context.subscribe(PerformanceIndicators.class);
    }

    @Override
    public Object receive(Object message) {
        if (message instanceof PerformanceIndicators indicators) {
            append(indicators);
        } else {
            log.warn("Ignoring unexpected message: {}", message);
        }
        return null;
    }

    private void append(PerformanceIndicators indicators) {
        try {
            writer.write(IndicatorCsvFormat.formatRow(indicators));
            writer.newLine();
            writer.flush();
            rowsWritten++;
        } catch (IOException e) {
            writeErrors++;
            log.error("Failed to append indicators for {} to {}, row dropped", indicators.symbol(), file, e);
        }
    }

    @Override
    public void postStop() throws IOException {
        if (writer == null) {
            return;
        }
        try (BufferedWriter closing = writer) {
            closing.flush();
        } finally {
            writer = null;
            log.info("Closed {} after {} rows ({} write errors)", file, rowsWritten, writeErrors);
        }
    }

    /**
     * Creates {@code <epochSeconds>.csv}, or {@code <epochSeconds>-<n>.csv} when taken.
     */
    private Path createUniqueFile(long epochSeconds) throws IOException {
        for (int attempt = 0; ; attempt++) {
            String name = attempt == 0 ? epochSeconds + ".csv" : epochSeconds + "-" + attempt + ".csv";
            try {
                return Files.createFile(outputDir.resolve(name));
            } catch (FileAlreadyExistsException e) {
                log.debug("{} already exists, trying next name", name);
            }
        }
    }

    public Path getFile() {
        return file;
    }

    public long getRowsWritten() {
        return rowsWritten;
    }
}
