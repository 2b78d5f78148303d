package com.cardrewards.ingest.service;

import com.cardrewards.ingest.domain.CanonicalRow;
import com.cardrewards.ingest.domain.ImportSummary;
import com.cardrewards.ingest.domain.PointsAssessment;
import com.cardrewards.ingest.domain.TransactionEntity;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.List;

/**
 * Service for persisting the rows of one normalized statement.
 * Responsibilities:
 * - Compute points for each row
 * - Drop rows whose natural key is already recorded
 * - Persist the remaining rows attributed to the current owner
 * <p>
 * The whole statement is one transaction: a failure on any row rolls back
 * every row of that statement.
 */
@Service
@Slf4j
public class TransactionImportService {

    private final TransactionRepository transactionRepository;
    private final PointsCalculator pointsCalculator;
    private final TransactionDeduplicator deduplicator;
    private final OwnerProvider ownerProvider;
    private final Clock clock;

    public TransactionImportService(TransactionRepository transactionRepository,
                                    PointsCalculator pointsCalculator,
                                    TransactionDeduplicator deduplicator,
                                    OwnerProvider ownerProvider,
                                    Clock clock) {
        this.transactionRepository = transactionRepository;
        this.pointsCalculator = pointsCalculator;
        this.deduplicator = deduplicator;
        this.ownerProvider = ownerProvider;
        this.clock = clock;
    }

    /**
     * Imports canonical rows, skipping re-imports.
     *
     * @param rows parsed rows of one statement
     * @param sourceFile name of the inbox file the rows came from
     * @return counts of added and skipped rows
     */
    @Transactional
    public ImportSummary importRows(List<CanonicalRow> rows, String sourceFile) {
        String ownerId = ownerProvider.currentOwnerId();
        int added = 0;
        int skipped = 0;

        for (CanonicalRow row : rows) {
            if (deduplicator.isDuplicate(row)) {
                log.debug("Skipping duplicate {} {} {} {}",
                        row.transactionDate(), row.description(), row.amount(), row.card());
                skipped++;
                continue;
            }

            PointsAssessment points = pointsCalculator.assess(row);
            transactionRepository.save(toEntity(row, points, ownerId, sourceFile));
            added++;
        }

        log.info("Imported {}: added={}, skipped={}", sourceFile, added, skipped);
        return new ImportSummary(added, skipped);
    }

    private TransactionEntity toEntity(CanonicalRow row, PointsAssessment points, String ownerId, String sourceFile) {
        return TransactionEntity.builder()
                .transactionDate(row.transactionDate())
                .description(row.description())
                .amount(row.amount())
                .category(row.category())
                .card(row.card())
                .multiplier(points.multiplier())
                .points(points.points())
                .ownerId(ownerId)
                .sourceFile(sourceFile)
                .createdAt(OffsetDateTime.now(clock))
                .build();
    }
}
