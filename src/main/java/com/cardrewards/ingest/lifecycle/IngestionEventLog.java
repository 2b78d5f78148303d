package com.cardrewards.ingest.lifecycle;

import com.cardrewards.ingest.config.IngestProperties;
import com.cardrewards.ingest.domain.IngestionEvent;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;
import org.springframework.stereotype.Component;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;

/**
 * Append-only CSV log of terminal file outcomes: {@code timestamp,filename,status,message}.
 * Lines are never rewritten.
 */
@Component
@Slf4j
public class IngestionEventLog {

    static final DateTimeFormatter TIMESTAMP_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss.SSSSSS");

    private static final CSVFormat LOG_FORMAT = CSVFormat.DEFAULT.builder()
            .setRecordSeparator("\n")
            .build();

    private final Path logFile;
    private final Clock clock;

    public IngestionEventLog(IngestProperties properties, Clock clock) {
        this.logFile = properties.logFile();
        this.clock = clock;
    }

    /**
     * Creates the log file and its parent directory if they do not exist yet.
     */
    public void ensureExists() throws IOException {
        Path parent = logFile.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        if (Files.notExists(logFile)) {
            Files.createFile(logFile);
        }
    }

    public synchronized IngestionEvent append(String filename, IngestionEvent.Status status, String message)
            throws IOException {
        IngestionEvent event = new IngestionEvent(
                LocalDateTime.now(clock), filename, status, message == null ? "" : message);

        try (BufferedWriter writer = Files.newBufferedWriter(logFile, StandardCharsets.UTF_8,
                StandardOpenOption.CREATE, StandardOpenOption.APPEND);
             CSVPrinter printer = new CSVPrinter(writer, LOG_FORMAT)) {
            printer.printRecord(
                    TIMESTAMP_FORMAT.format(event.timestamp()),
                    event.filename(),
                    event.status().label(),
                    event.message());
        }
        log.debug("Event logged: {} {}", filename, status.label());
        return event;
    }

    public Path getLogFile() {
        return logFile;
    }
}
