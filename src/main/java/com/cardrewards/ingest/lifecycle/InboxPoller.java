package com.cardrewards.ingest.lifecycle;

import com.cardrewards.ingest.config.IngestProperties;
import com.cardrewards.ingest.domain.FileOutcome;
import com.cardrewards.ingest.domain.FileState;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Polls the inbox on a fixed delay and hands each CSV file, in filename order,
 * to the {@link StatementFileProcessor}. Files are processed one after another.
 */
@Component
@Slf4j
public class InboxPoller {

    private static final String CSV_GLOB = "*.csv";

    private final IngestProperties properties;
    private final StatementFileProcessor processor;
    private final IngestionEventLog eventLog;

    public InboxPoller(IngestProperties properties, StatementFileProcessor processor, IngestionEventLog eventLog) {
        this.properties = properties;
        this.processor = processor;
        this.eventLog = eventLog;
    }

    @PostConstruct
    public void prepareDirectories() throws IOException {
        Files.createDirectories(properties.incomingDir());
        Files.createDirectories(properties.processedDir());
        Files.createDirectories(properties.failedDir());
        eventLog.ensureExists();
        log.info("Watching for new CSV files in {} (every {} ms), log {}",
                properties.incomingDir(), properties.pollIntervalMs(), eventLog.getLogFile());
    }

    @Scheduled(fixedDelayString = "${ingest.poll-interval-ms:30000}")
    public void scheduledPoll() {
        try {
            pollOnce();
        } catch (IOException e) {
            log.error("Could not list inbox {}", properties.incomingDir(), e);
        }
    }

    /**
     * Runs one poll cycle.
     *
     * @return outcome per file found, in processing order
     * @throws IOException if the inbox cannot be listed
     */
    public List<FileOutcome> pollOnce() throws IOException {
        List<Path> files = listInbox();
        List<FileOutcome> outcomes = new ArrayList<>(files.size());

        for (Path file : files) {
            try {
                outcomes.add(processor.process(file));
            } catch (RuntimeException e) {
                log.error("Unexpected error processing {}", file.getFileName(), e);
                outcomes.add(FileOutcome.failed(file.getFileName().toString(), e.getMessage()));
            }
        }

        long processed = outcomes.stream().filter(o -> o.state() == FileState.ARCHIVED_PROCESSED).count();
        long failed = outcomes.stream().filter(o -> o.state() == FileState.ARCHIVED_FAILED).count();
        if (processed > 0 || failed > 0) {
            log.info("Poll cycle complete: {} processed, {} failed, {} already handled",
                    processed, failed, outcomes.size() - processed - failed);
        }
        return outcomes;
    }

    List<Path> listInbox() throws IOException {
        List<Path> files = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(properties.incomingDir(), CSV_GLOB)) {
            for (Path path : stream) {
                if (Files.isRegularFile(path)) {
                    files.add(path);
                }
            }
        }
        files.sort(Comparator.comparing(path -> path.getFileName().toString()));
        return files;
    }
}
