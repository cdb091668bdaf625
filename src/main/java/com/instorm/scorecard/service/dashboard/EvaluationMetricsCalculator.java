package com.instorm.scorecard.service.dashboard;

import com.instorm.scorecard.model.dto.EvaluationItem;
import com.instorm.scorecard.model.dto.EvaluationRecord;
import com.instorm.scorecard.model.dto.IndividualMetrics;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.LocalDate;
import java.time.YearMonth;
import java.util.List;

/**
 * Reduces a user's own evaluations into the individual dashboard numbers.
 *
 * The average score is the mean of the per-evaluation means, not the mean over all
 * item scores. An evaluation without items counts as a mean of 0 and still counts
 * towards the number of evaluations.
 */
@Component
public class EvaluationMetricsCalculator {

    private final Clock clock;

    public EvaluationMetricsCalculator(Clock clock) {
        this.clock = clock;
    }

    public IndividualMetrics calculate(List<EvaluationRecord> evaluations) {
        return calculate(evaluations, YearMonth.now(clock));
    }

    /**
     * @param currentMonth month that {@code thisMonth} is counted against, fixed for the whole pass
     */
    public IndividualMetrics calculate(List<EvaluationRecord> evaluations, YearMonth currentMonth) {
        if (evaluations == null || evaluations.isEmpty()) {
            return IndividualMetrics.zeroed();
        }

        double sumOfMeans = 0.0;
        double totalScore = 0.0;
        int thisMonth = 0;

        for (EvaluationRecord evaluation : evaluations) {
            double evaluationSum = sumOfScores(evaluation.items());
            totalScore += evaluationSum;
            if (!evaluation.items().isEmpty()) {
                sumOfMeans += evaluationSum / evaluation.items().size();
            }
            if (isInMonth(evaluation.visitDate(), currentMonth)) {
                thisMonth++;
            }
        }

        // exact binary value, so 0.15 rounds down to 0.1
        BigDecimal averageScore = new BigDecimal(sumOfMeans / evaluations.size())
                .setScale(1, RoundingMode.HALF_UP);
        return new IndividualMetrics(evaluations.size(), averageScore, totalScore, thisMonth);
    }

    private static double sumOfScores(List<EvaluationItem> items) {
        return items.stream().mapToDouble(EvaluationItem::score).sum();
    }

    private static boolean isInMonth(LocalDate visitDate, YearMonth month) {
        return visitDate != null && YearMonth.from(visitDate).equals(month);
    }
}
