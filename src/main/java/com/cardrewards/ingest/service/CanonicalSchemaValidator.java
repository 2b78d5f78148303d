package com.cardrewards.ingest.service;

import com.cardrewards.ingest.domain.CanonicalSchema;
import com.cardrewards.ingest.exception.StatementValidationException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.StringReader;
import java.io.UncheckedIOException;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Structural gate for normalizer output.
 * Only the header row is inspected; row values are checked later by {@link CanonicalCsvParser}.
 * Header names are trimmed and compared case-insensitively.
 */
@Component
@Slf4j
public class CanonicalSchemaValidator {

    private static final CSVFormat HEADER_FORMAT = CSVFormat.DEFAULT.builder()
            .setHeader()
            .setSkipHeaderRecord(true)
            .setAllowMissingColumnNames(true)
            .setIgnoreSurroundingSpaces(true)
            .build();

    /**
     * Cheap sanity check run before full validation: the first line must mention
     * the transaction date header.
     */
    public boolean hasHeaderLine(String content) {
        if (content == null) {
            return false;
        }
        return content.lines()
                .findFirst()
                .map(line -> line.toLowerCase(Locale.ROOT).contains(CanonicalSchema.TRANSACTION_DATE))
                .orElse(false);
    }

    /**
     * @return the canonical fields absent from the header row, empty when the content is valid
     */
    public List<String> missingFields(String content) {
        Set<String> headers = readHeaders(content);
        return CanonicalSchema.STANDARD_HEADERS.stream()
                .filter(field -> !headers.contains(field))
                .toList();
    }

    public boolean isValid(String content) {
        return missingFields(content).isEmpty();
    }

    /**
     * @throws StatementValidationException if any canonical field is missing from the header row
     */
    public void validate(String content) {
        List<String> missing = missingFields(content);
        if (!missing.isEmpty()) {
            throw new StatementValidationException(
                    "Validation failed: CSV headers missing or incorrect " + missing);
        }
        log.debug("Normalized content exposes all canonical headers");
    }

    private Set<String> readHeaders(String content) {
        if (content == null || content.isBlank()) {
            return Set.of();
        }
        try (CSVParser parser = HEADER_FORMAT.parse(new StringReader(content))) {
            return parser.getHeaderNames().stream()
                    .map(name -> name.trim().toLowerCase(Locale.ROOT))
                    .collect(Collectors.toSet());
        } catch (IOException | UncheckedIOException | IllegalArgumentException e) {
            log.debug("Could not read a header row from normalized content: {}", e.getMessage());
            return Set.of();
        }
    }
}
