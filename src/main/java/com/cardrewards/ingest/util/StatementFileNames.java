package com.cardrewards.ingest.util;

import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

/**
 * Naming rules for inbox files and the artifacts derived from them.
 * <p>
 * An inbox file {@code Amex_2024-03.csv} belongs to card {@code amex}, is archived
 * as {@code raw_Amex_2024-03.csv}, produces {@code Amex_2024-03_normalized_<timestamp>.csv}
 * and is marked done by the sibling {@code Amex_2024-03.processed}.
 */
public final class StatementFileNames {

    public static final String MARKER_SUFFIX = ".processed";
    public static final String RAW_PREFIX = "raw_";
    public static final String NORMALIZED_INFIX = "_normalized_";

    private static final DateTimeFormatter OUTPUT_TIMESTAMP = DateTimeFormatter.ofPattern("yyyyMMddHHmmss");

    private StatementFileNames() {}

    /**
     * File name without its last extension.
     */
    public static String stem(Path file) {
        String name = file.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }

    /**
     * Card label: text before the first underscore of the stem, lowercased.
     */
    public static String cardLabel(Path file) {
        String stem = stem(file);
        int underscore = stem.indexOf('_');
        String label = underscore >= 0 ? stem.substring(0, underscore) : stem;
        return label.toLowerCase(Locale.ROOT);
    }

    /**
     * Completion marker sitting next to the inbox file.
     */
    public static Path markerFor(Path file) {
        return file.resolveSibling(stem(file) + MARKER_SUFFIX);
    }

    public static String rawArchiveName(Path file) {
        return RAW_PREFIX + file.getFileName();
    }

    public static String normalizedOutputName(Path file, LocalDateTime timestamp) {
        return stem(file) + NORMALIZED_INFIX + OUTPUT_TIMESTAMP.format(timestamp) + ".csv";
    }
}
