package com.cardrewards.ingest.prompt;

import com.cardrewards.ingest.domain.CanonicalSchema;

/**
 * Instruction template sent to the text-generation model for statement normalization.
 */
public final class NormalizationPrompt {

    private NormalizationPrompt() {}

    /**
     * Builds the single-turn prompt for one raw statement.
     *
     * @param rawCsv the statement file contents, any CSV dialect
     * @param cardLabel card identifier every output row must carry
     * @return prompt text
     */
    public static String build(String rawCsv, String cardLabel) {
        return """
            You are a financial transaction normalizer.
            Given raw CSV data from a credit card statement, return only valid transaction rows in CSV format with the headers:
            %s

            Requirements:
            - Dates must be ISO format: YYYY-MM-DD
            - Amount must be numeric, no currency symbols
            - Card must be set to: %s
            - No introductory/explanatory text. Just CSV output.

            Here is the raw data:
            %s
            """.formatted(CanonicalSchema.HEADER_LINE, cardLabel, rawCsv);
    }
}
