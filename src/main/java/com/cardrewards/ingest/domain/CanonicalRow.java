package com.cardrewards.ingest.domain;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * One parsed statement row in canonical form, not yet persisted.
 * Description, category and card are already trimmed; a blank category is {@code null}.
 */
public record CanonicalRow(
    LocalDate transactionDate,
    String description,
    BigDecimal amount,
    String category,
    String card
) {

    public boolean hasCategory() {
        return category != null && !category.isBlank();
    }

    public boolean hasCard() {
        return card != null && !card.isBlank();
    }
}
