package com.cardrewards.ingest.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.OffsetDateTime;

/**
 * JPA entity for a recorded card transaction.
 * Rows are written once by the import and never updated afterwards.
 */
@Entity
@Table(name = "transactions", indexes = {
        @Index(name = "idx_transactions_date", columnList = "transaction_date"),
        @Index(name = "idx_transactions_natural_key", columnList = "transaction_date, amount, card")
})
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TransactionEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "transaction_date", nullable = false)
    private LocalDate transactionDate;

    @Column(nullable = false, length = 1000)
    private String description;

    @Column(nullable = false, precision = 10, scale = 2)
    private BigDecimal amount;

    @Column(length = 255)
    private String category;

    @Column(nullable = false)
    private String card;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "multiplier_id")
    private RewardMultiplierEntity multiplier;

    /** {@code null} when points are not applicable. */
    @Column(precision = 10, scale = 2)
    private BigDecimal points;

    @Column(name = "owner_id", nullable = false)
    private String ownerId;

    @Column(name = "source_file")
    private String sourceFile;

    @Column(name = "created_at", nullable = false)
    private OffsetDateTime createdAt;
}
