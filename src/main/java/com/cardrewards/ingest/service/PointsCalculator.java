package com.cardrewards.ingest.service;

import com.cardrewards.ingest.domain.CanonicalRow;
import com.cardrewards.ingest.domain.PointsAssessment;
import com.cardrewards.ingest.domain.RewardMultiplierEntity;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Computes reward points for a canonical row.
 * <p>
 * Points are not applicable for auto-pay transfers, for rows without a category
 * or card, and when no multiplier row matches the exact (category, card) pair.
 * Otherwise the amount is rounded to a whole number (half-even) and multiplied
 * by the integer multiplier.
 */
@Component
@Slf4j
public class PointsCalculator {

    private static final Pattern AUTO_WORD = Pattern.compile("\\bAUTO\\b");
    private static final Pattern PAY_WORD = Pattern.compile("\\bPAY\\b");
    private static final Pattern AUTOPAY_WORD = Pattern.compile("\\bAUTOPAY\\b");

    static final RoundingMode AMOUNT_ROUNDING = RoundingMode.HALF_EVEN;

    private final RewardMultiplierRepository multiplierRepository;

    public PointsCalculator(RewardMultiplierRepository multiplierRepository) {
        this.multiplierRepository = multiplierRepository;
    }

    public PointsAssessment assess(CanonicalRow row) {
        if (isAutoPay(row.description())) {
            log.debug("Auto-pay excluded from points: {}", row.description());
            return PointsAssessment.notApplicable();
        }
        if (!row.hasCategory() || !row.hasCard()) {
            return PointsAssessment.notApplicable();
        }

        Optional<RewardMultiplierEntity> multiplier =
                multiplierRepository.findByCategoryAndCard(row.category(), row.card());
        if (multiplier.isEmpty()) {
            log.debug("No multiplier for ({}, {})", row.category(), row.card());
            return PointsAssessment.notApplicable();
        }

        return new PointsAssessment(pointsFor(row.amount(), multiplier.get().getMultiplier()), multiplier.get());
    }

    /**
     * True when the uppercased description holds the whole words AUTO and PAY,
     * or the single word AUTOPAY.
     */
    public static boolean isAutoPay(String description) {
        if (description == null) {
            return false;
        }
        String upper = description.toUpperCase(Locale.ROOT);
        return (AUTO_WORD.matcher(upper).find() && PAY_WORD.matcher(upper).find())
                || AUTOPAY_WORD.matcher(upper).find();
    }

    /**
     * Rounds the amount to a whole number, then multiplies.
     *
     * @return the integer product at scale 2
     */
    public static BigDecimal pointsFor(BigDecimal amount, int multiplier) {
        BigDecimal wholeAmount = amount.setScale(0, AMOUNT_ROUNDING);
        return wholeAmount.multiply(BigDecimal.valueOf(multiplier)).setScale(2, RoundingMode.UNNECESSARY);
    }
}
