package com.cardrewards.ingest.service;

import com.cardrewards.ingest.domain.TransactionEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Spring Data JPA repository for recorded transactions.
 */
@Repository
public interface TransactionRepository extends JpaRepository<TransactionEntity, Long> {

    /**
     * Checks for a recorded transaction with the same natural key.
     * Category and points are deliberately not part of the key.
     *
     * @param transactionDate the posting date
     * @param description the trimmed description, compared case-sensitively
     * @param amount the signed amount
     * @param card the trimmed card identifier
     * @return true if a matching transaction exists
     */
    boolean existsByTransactionDateAndDescriptionAndAmountAndCard(
            LocalDate transactionDate, String description, BigDecimal amount, String card);
}
