package com.cardrewards.ingest.service;

import com.cardrewards.ingest.domain.CanonicalRow;
import org.springframework.stereotype.Component;

/**
 * Detects re-imports by the natural key (date, description, amount, card).
 */
@Component
public class TransactionDeduplicator {

    private final TransactionRepository transactionRepository;

    public TransactionDeduplicator(TransactionRepository transactionRepository) {
        this.transactionRepository = transactionRepository;
    }

    public boolean isDuplicate(CanonicalRow row) {
        return transactionRepository.existsByTransactionDateAndDescriptionAndAmountAndCard(
                row.transactionDate(), row.description(), row.amount(), row.card());
    }
}
