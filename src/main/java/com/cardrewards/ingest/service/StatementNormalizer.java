package com.cardrewards.ingest.service;

/**
 * Converts an arbitrary statement export into canonical CSV text.
 * The returned text is untrusted until it passes {@link CanonicalSchemaValidator}.
 */
@FunctionalInterface
public interface StatementNormalizer {

    /**
     * @param rawCsv full statement file contents
     * @param cardLabel card identifier the output rows must carry
     * @return the normalizer's response, verbatim
     * @throws com.cardrewards.ingest.exception.NormalizationException if no usable response was obtained
     */
    String normalize(String rawCsv, String cardLabel);
}
