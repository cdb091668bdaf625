package com.instorm.scorecard.service.dashboard;

import com.instorm.scorecard.model.dto.EvaluationItem;
import com.instorm.scorecard.model.dto.EvaluationRecord;
import com.instorm.scorecard.model.dto.IndividualMetrics;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class EvaluationMetricsCalculatorTest {

    private static final LocalDate TODAY = LocalDate.of(2026, 10, 19);

    private EvaluationMetricsCalculator calculator;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.parse("2026-10-19T10:15:30Z"), ZoneOffset.UTC);
        calculator = new EvaluationMetricsCalculator(clock);
    }

    @Test
    void testNoEvaluationsGivesZeroedMetrics() {
        IndividualMetrics metrics = calculator.calculate(Collections.emptyList());

        assertEquals(0, metrics.totalEvaluations());
        assertEquals(0, metrics.averageScore().compareTo(BigDecimal.ZERO));
        assertEquals("0.0", metrics.averageScore().toPlainString());
        assertEquals(0.0, metrics.totalScore());
        assertEquals(0, metrics.thisMonth());
    }

    @Test
    void testSingleEvaluationThisMonth() {
        EvaluationRecord evaluation = evaluation("e-1", TODAY, 4, 6);

        IndividualMetrics metrics = calculator.calculate(List.of(evaluation));

        assertEquals(1, metrics.totalEvaluations());
        assertEquals("5.0", metrics.averageScore().toPlainString());
        assertEquals(10.0, metrics.totalScore());
        assertEquals(1, metrics.thisMonth());
    }

    @Test
    void testEvaluationWithoutItemsCountsAsZeroMean() {
        List<EvaluationRecord> evaluations = Arrays.asList(
                evaluation("e-1", TODAY, 4, 6),
                evaluation("e-2", TODAY.minusDays(3))
        );

        IndividualMetrics metrics = calculator.calculate(evaluations);

        assertEquals(2, metrics.totalEvaluations());
        // (5.0 + 0) / 2
        assertEquals("2.5", metrics.averageScore().toPlainString());
        assertEquals(10.0, metrics.totalScore());
        assertEquals(2, metrics.thisMonth());
    }

    @Test
    void testAverageIsMeanOfPerEvaluationMeans() {
        List<EvaluationRecord> evaluations = List.of(
                evaluation("e-1", TODAY, 5),
                evaluation("e-2", TODAY, 1, 1, 1)
        );

        IndividualMetrics metrics = calculator.calculate(evaluations);

        // per-evaluation means 5 and 1; a flat mean over all four items would be 2.0
        assertEquals("3.0", metrics.averageScore().toPlainString());
        assertEquals(8.0, metrics.totalScore());
    }

    @Test
    void testAverageIsRoundedToOneDecimal() {
        List<EvaluationRecord> evaluations = List.of(
                evaluation("e-1", TODAY, 4, 5),
                evaluation("e-2", TODAY, 3, 4),
                evaluation("e-3", TODAY)
        );

        IndividualMetrics metrics = calculator.calculate(evaluations);

        // (4.5 + 3.5 + 0) / 3 = 2.666...
        assertEquals(new BigDecimal("2.7"), metrics.averageScore());
    }

    @Test
    void testRoundingUsesTheExactBinaryValue() {
        // 0.15 is stored as 0.1499999999999999944...
        IndividualMetrics metrics = calculator.calculate(List.of(evaluation("e-1", TODAY, 0.15)));

        assertEquals("0.1", metrics.averageScore().toPlainString());
    }

    @Test
    void testThisMonthMatchesMonthAndYear() {
        List<EvaluationRecord> evaluations = List.of(
                evaluation("same-month", LocalDate.of(2026, 10, 1), 3),
                evaluation("last-month", LocalDate.of(2026, 9, 30), 3),
                evaluation("last-year", LocalDate.of(2025, 10, 19), 3),
                evaluation("no-date", null, 3)
        );

        IndividualMetrics metrics = calculator.calculate(evaluations);

        assertEquals(4, metrics.totalEvaluations());
        assertEquals(1, metrics.thisMonth());
        assertEquals(12.0, metrics.totalScore());
    }

    @Test
    void testNullListIsTreatedAsEmpty() {
        assertEquals(IndividualMetrics.zeroed(), calculator.calculate(null));
    }

    private static EvaluationRecord evaluation(String id, LocalDate visitDate, double... scores) {
        List<EvaluationItem> items = Arrays.stream(scores).mapToObj(EvaluationItem::new).toList();
        return new EvaluationRecord(id, visitDate, items);
    }
}
