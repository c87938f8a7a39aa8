package com.surveyaudit.rule.checker;

import com.surveyaudit.TestDatasets;
import com.surveyaudit.model.*;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class StatisticalCheckersTest {

    @Test
    void shouldFlagZScoreOutliersAgainstWholeDataset() {
        ZScoreOutlierChecker checker = new ZScoreOutlierChecker();
        Dataset dataset = series("spend", 20, 19, 100);

        CheckOutcome whole = checker.check(context(dataset, checker.defaultParameters(), null, null));
        CheckOutcome tail = checker.check(context(dataset, checker.defaultParameters(), 15, 20));
        CheckOutcome head = checker.check(context(dataset, checker.defaultParameters(), 0, 15));

        assertEquals(1, whole.findings().size());
        assertEquals(19, whole.findings().get(0).recordIndex());
        assertTrue((double) whole.findings().get(0).details().get("zScore") > 4.0);
        assertEquals(whole.findings(), tail.findings());
        assertTrue(head.findings().isEmpty());
    }

    @Test
    void shouldReportInsufficientDataForSmallDatasets() {
        ZScoreOutlierChecker checker = new ZScoreOutlierChecker();

        CheckOutcome outcome = checker.check(context(series("small", 5, 4, 100), checker.defaultParameters(), null, null));

        assertTrue(outcome.isInsufficientData());
    }

    @Test
    void shouldFlagAbnormallySlowCompletion() {
        SlowResponseChecker checker = new SlowResponseChecker();
        List<Map<String, Object>> rows = new ArrayList<>();
        for (int i = 0; i < 20; i++) {
            rows.add(TestDatasets.row("duration", 300));
        }
        rows.add(TestDatasets.row("duration", 5000));
        Dataset dataset = TestDatasets.dataset("slow", List.of(
                TestDatasets.withRole("duration", FieldType.NUMERIC, FieldRole.DURATION_SECONDS)), rows);

        CheckOutcome outcome = checker.check(context(dataset, checker.defaultParameters(), null, null));

        assertEquals(1, outcome.findings().size());
        assertEquals(20, outcome.findings().get(0).recordIndex());
    }

    @Test
    void shouldFlagZigzagAndDiagonalBatteries() {
        ZigzagPatternChecker checker = new ZigzagPatternChecker();
        Dataset dataset = TestDatasets.battery("patterns", List.of(
                new double[]{1, 5, 1, 5, 1, 5, 1, 5, 1, 5},
                new double[]{1, 2, 3, 4, 5},
                new double[]{3, 3, 3, 3, 3, 3, 3, 3, 3, 3},
                new double[]{2, 4, 1, 5, 3, 3, 2, 5, 1, 4}));

        CheckOutcome outcome = checker.check(context(dataset, checker.defaultParameters(), null, null));

        assertEquals(2, outcome.findings().size());
        assertEquals("zigzag", outcome.findings().get(0).key());
        assertEquals(0, outcome.findings().get(0).recordIndex());
        assertEquals("diagonal", outcome.findings().get(1).key());
        assertEquals(1, outcome.findings().get(1).recordIndex());
    }

    private static Dataset series(String id, int size, int outlierIndex, double outlier) {
        List<Map<String, Object>> rows = new ArrayList<>();
        for (int i = 0; i < size; i++) {
            rows.add(TestDatasets.row("q1", i == outlierIndex ? outlier : 3));
        }
        return TestDatasets.dataset(id, List.of(TestDatasets.numeric("q1")), rows);
    }

    private static CheckContext context(Dataset dataset, Map<String, Object> parameters, Integer from, Integer to) {
        return CheckContext.builder()
                .dataset(dataset)
                .fromIndex(from)
                .toIndex(to)
                .parameters(CheckParameters.of(parameters))
                .build();
    }
}
