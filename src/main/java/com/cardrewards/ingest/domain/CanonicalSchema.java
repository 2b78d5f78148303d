package com.cardrewards.ingest.domain;

import java.util.List;

/**
 * Field names every normalized statement must expose before it can enter the store.
 */
public final class CanonicalSchema {

    public static final String TRANSACTION_DATE = "transaction_date";
    public static final String DESCRIPTION = "description";
    public static final String AMOUNT = "amount";
    public static final String CATEGORY = "category";
    public static final String CARD = "card";

    /** Header fields in the order the normalizer is asked to emit them. */
    public static final List<String> STANDARD_HEADERS =
            List.of(TRANSACTION_DATE, DESCRIPTION, AMOUNT, CATEGORY, CARD);

    public static final String HEADER_LINE = String.join(", ", STANDARD_HEADERS);

    private CanonicalSchema() {}
}
