package com.cardrewards.ingest.lifecycle;

import com.cardrewards.ingest.config.IngestProperties;
import com.cardrewards.ingest.domain.CanonicalRow;
import com.cardrewards.ingest.domain.FileOutcome;
import com.cardrewards.ingest.domain.FileState;
import com.cardrewards.ingest.domain.ImportSummary;
import com.cardrewards.ingest.domain.IngestionEvent;
import com.cardrewards.ingest.lifecycle.FileLifecycle.StepResult;
import com.cardrewards.ingest.lifecycle.FileLifecycle.Transition;
import com.cardrewards.ingest.service.CanonicalCsvParser;
import com.cardrewards.ingest.service.CanonicalSchemaValidator;
import com.cardrewards.ingest.service.StatementNormalizer;
import com.cardrewards.ingest.service.TransactionImportService;
import com.cardrewards.ingest.util.StatementFileNames;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Drives one inbox file through {@link FileLifecycle} and performs the archive side effects.
 * <p>
 * Every failure is contained here: the file lands in the failed archive with a
 * {@code failed} log line and the caller always gets a {@link FileOutcome}.
 */
@Component
@Slf4j
public class StatementFileProcessor {

    private final IngestProperties properties;
    private final StatementNormalizer normalizer;
    private final CanonicalSchemaValidator validator;
    private final CanonicalCsvParser parser;
    private final TransactionImportService importService;
    private final IngestionEventLog eventLog;
    private final Clock clock;

    private final Set<String> inFlight = ConcurrentHashMap.newKeySet();

    public StatementFileProcessor(IngestProperties properties,
                                  StatementNormalizer normalizer,
                                  CanonicalSchemaValidator validator,
                                  CanonicalCsvParser parser,
                                  TransactionImportService importService,
                                  IngestionEventLog eventLog,
                                  Clock clock) {
        this.properties = properties;
        this.normalizer = normalizer;
        this.validator = validator;
        this.parser = parser;
        this.importService = importService;
        this.eventLog = eventLog;
        this.clock = clock;
    }

    /**
     * Processes one inbox file to a terminal state.
     * A file name already being processed by another caller is reported as already handled.
     *
     * @param file path of a CSV file inside the inbox
     * @return the terminal outcome
     */
    public FileOutcome process(Path file) {
        String filename = file.getFileName().toString();
        if (!inFlight.add(filename)) {
            log.debug("{} is already being processed", filename);
            return FileOutcome.alreadyHandled(filename);
        }
        try {
            return drive(new FileRun(file));
        } finally {
            inFlight.remove(filename);
        }
    }

    private FileOutcome drive(FileRun run) {
        FileState state = FileState.DISCOVERED;
        FileOutcome outcome = null;

        while (!state.isTerminal()) {
            StepResult result = runStep(state, run);
            Transition transition = FileLifecycle.advance(state, result);
            log.debug("{}: {} -> {}", run.filename, state, transition.next());
            state = transition.next();

            outcome = switch (transition.effect()) {
                case NONE -> null;
                case ARCHIVE_PROCESSED -> archiveProcessed(run);
                case ARCHIVE_FAILED -> archiveFailed(run);
            };
        }

        return outcome != null ? outcome : FileOutcome.alreadyHandled(run.filename);
    }

    private StepResult runStep(FileState state, FileRun run) {
        try {
            return switch (state) {
                case DISCOVERED -> Files.exists(run.marker) ? StepResult.MARKER_PRESENT : StepResult.PASSED;
                case NORMALIZING -> {
                    run.normalized = normalizer.normalize(readStatement(run.file), run.cardLabel);
                    yield StepResult.PASSED;
                }
                case NORMALIZED -> {
                    if (!validator.hasHeaderLine(run.normalized)) {
                        run.failure = "Normalizer response missing headers";
                        yield StepResult.FAILED;
                    }
                    yield StepResult.PASSED;
                }
                case VALIDATING -> {
                    validator.validate(run.normalized);
                    yield StepResult.PASSED;
                }
                case IMPORTING -> {
                    List<CanonicalRow> rows = parser.parse(run.normalized);
                    run.summary = importService.importRows(rows, run.filename);
                    yield StepResult.PASSED;
                }
                default -> throw new IllegalStateException("No step for state " + state);
            };
        } catch (Exception e) {
            run.failure = describe(e);
            log.warn("{} failed while {}: {}", run.filename, state, run.failure);
            return StepResult.FAILED;
        }
    }

    private FileOutcome archiveProcessed(FileRun run) {
        Path output = properties.processedDir()
                .resolve(StatementFileNames.normalizedOutputName(run.file, LocalDateTime.now(clock)));
        try {
            Files.writeString(output, run.normalized, StandardCharsets.UTF_8);
            move(run.file, properties.processedDir().resolve(StatementFileNames.rawArchiveName(run.file)));
            if (Files.notExists(run.marker)) {
                Files.createFile(run.marker);
            }
        } catch (IOException e) {
            run.failure = "Archiving processed output failed: " + describe(e);
            log.error("{}: {}", run.filename, run.failure, e);
            discardOutput(output);
            return archiveFailed(run);
        }

        appendEvent(run.filename, IngestionEvent.Status.PROCESSED, "");
        ImportSummary summary = run.summary != null ? run.summary : ImportSummary.empty();
        log.info("Processed: {} (added={}, skipped={})", run.filename, summary.added(), summary.skipped());
        return FileOutcome.processed(run.filename, summary);
    }

    private FileOutcome archiveFailed(FileRun run) {
        if (Files.exists(run.file)) {
            try {
                move(run.file, properties.failedDir().resolve(run.filename));
            } catch (IOException e) {
                log.error("Could not move {} to the failed archive", run.filename, e);
            }
        }

        appendEvent(run.filename, IngestionEvent.Status.FAILED, run.failure);
        log.warn("Failed: {} - {}", run.filename, run.failure);
        return FileOutcome.failed(run.filename, run.failure);
    }

    /**
     * Removes a normalized output left behind by a file that ends up in the failed archive.
     */
    private void discardOutput(Path output) {
        try {
            Files.deleteIfExists(output);
        } catch (IOException e) {
            log.error("Could not remove normalized output {}", output, e);
        }
    }

    private void appendEvent(String filename, IngestionEvent.Status status, String message) {
        try {
            eventLog.append(filename, status, message);
        } catch (IOException e) {
            log.error("Could not append {} event for {} to {}", status.label(), filename, eventLog.getLogFile(), e);
        }
    }

    /**
     * Moves atomically where the file system allows it, replacing an older copy otherwise.
     */
    private void move(Path source, Path target) throws IOException {
        try {
            Files.move(source, target, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    /**
     * Reads the statement as UTF-8, falling back to ISO-8859-1 for legacy bank exports.
     */
    private String readStatement(Path file) throws IOException {
        byte[] bytes = Files.readAllBytes(file);
        try {
            return StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(bytes))
                    .toString();
        } catch (CharacterCodingException e) {
            log.debug("{} is not valid UTF-8, decoding as ISO-8859-1", file.getFileName());
            return new String(bytes, StandardCharsets.ISO_8859_1);
        }
    }

    private static String describe(Exception e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }

    /**
     * Mutable per-file working state shared by the steps of one run.
     */
    private static final class FileRun {
        private final Path file;
        private final String filename;
        private final String cardLabel;
        private final Path marker;
        private String normalized;
        private ImportSummary summary;
        private String failure;

        private FileRun(Path file) {
            this.file = file;
            this.filename = file.getFileName().toString();
            this.cardLabel = StatementFileNames.cardLabel(file);
            this.marker = StatementFileNames.markerFor(file);
        }
    }
}
