package com.cardrewards.ingest.domain;

import java.math.BigDecimal;

/**
 * Points earned by a transaction together with the multiplier row that produced them.
 * Both fields are {@code null} when points are not applicable.
 */
public record PointsAssessment(
    BigDecimal points,
    RewardMultiplierEntity multiplier
) {

    private static final PointsAssessment NOT_APPLICABLE = new PointsAssessment(null, null);

    public static PointsAssessment notApplicable() {
        return NOT_APPLICABLE;
    }

    public boolean isApplicable() {
        return points != null;
    }
}
