package com.instorm.scorecard.model.dto;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Summary numbers for an individual contributor's dashboard. Derived on every
 * load and never persisted.
 *
 * @param averageScore mean of per-evaluation means, always at scale 1
 */
public record IndividualMetrics(
    int totalEvaluations,
    BigDecimal averageScore,
    double totalScore,
    int thisMonth
) {

    public static final BigDecimal ZERO_SCORE = BigDecimal.ZERO.setScale(1, RoundingMode.HALF_UP);

    public static IndividualMetrics zeroed() {
        return new IndividualMetrics(0, ZERO_SCORE, 0.0, 0);
    }
}
