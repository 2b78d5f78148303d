package com.cardrewards.ingest.service;

import com.cardrewards.ingest.domain.CanonicalRow;
import com.cardrewards.ingest.domain.CanonicalSchema;
import com.cardrewards.ingest.exception.StatementParseException;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.StringReader;
import java.io.UncheckedIOException;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;

/**
 * Parses validated canonical CSV into rows.
 * Any malformed row fails the whole statement.
 */
@Component
public class CanonicalCsvParser {

    private static final CSVFormat CANONICAL_FORMAT = CSVFormat.DEFAULT.builder()
            .setHeader()
            .setSkipHeaderRecord(true)
            .setIgnoreHeaderCase(true)
            .setAllowMissingColumnNames(true)
            .setIgnoreEmptyLines(true)
            .setTrim(true)
            .build();

    private static final int MAX_AMOUNT_SCALE = 2;

    public List<CanonicalRow> parse(String content) {
        List<CanonicalRow> rows = new ArrayList<>();
        long recordNumber = 0;

        try (CSVParser parser = CANONICAL_FORMAT.parse(new StringReader(content))) {
            for (CSVRecord csvRecord : parser) {
                recordNumber++;
                rows.add(toRow(csvRecord, recordNumber));
            }
        } catch (IOException | UncheckedIOException e) {
            throw new StatementParseException(recordNumber + 1, "unreadable CSV: " + e.getMessage(), e);
        }
        return rows;
    }

    private CanonicalRow toRow(CSVRecord csvRecord, long recordNumber) {
        String rawDate = field(csvRecord, CanonicalSchema.TRANSACTION_DATE, recordNumber);
        String description = field(csvRecord, CanonicalSchema.DESCRIPTION, recordNumber);
        String rawAmount = field(csvRecord, CanonicalSchema.AMOUNT, recordNumber);
        String category = field(csvRecord, CanonicalSchema.CATEGORY, recordNumber);
        String card = field(csvRecord, CanonicalSchema.CARD, recordNumber);

        LocalDate date;
        try {
            date = LocalDate.parse(rawDate);
        } catch (DateTimeParseException e) {
            throw new StatementParseException(recordNumber, "invalid transaction_date '" + rawDate + "'", e);
        }

        BigDecimal parsedAmount;
        try {
            parsedAmount = new BigDecimal(rawAmount);
        } catch (NumberFormatException e) {
            throw new StatementParseException(recordNumber, "invalid amount '" + rawAmount + "'", e);
        }
        if (parsedAmount.stripTrailingZeros().scale() > MAX_AMOUNT_SCALE) {
            throw new StatementParseException(recordNumber,
                    "amount '" + rawAmount + "' has more than " + MAX_AMOUNT_SCALE + " decimal places");
        }
        BigDecimal amount = parsedAmount.setScale(MAX_AMOUNT_SCALE, RoundingMode.UNNECESSARY);

        if (description.isEmpty()) {
            throw new StatementParseException(recordNumber, "description is required");
        }
        if (card.isEmpty()) {
            throw new StatementParseException(recordNumber, "card is required");
        }

        return new CanonicalRow(date, description, amount, category.isEmpty() ? null : category, card);
    }

    private String field(CSVRecord csvRecord, String name, long recordNumber) {
        try {
            String value = csvRecord.get(name);
            return value == null ? "" : value.trim();
        } catch (IllegalArgumentException | IllegalStateException e) {
            throw new StatementParseException(recordNumber, "missing " + name + " value", e);
        }
    }
}
