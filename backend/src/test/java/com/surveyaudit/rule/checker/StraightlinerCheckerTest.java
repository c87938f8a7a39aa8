package com.surveyaudit.rule.checker;

import com.surveyaudit.TestDatasets;
import com.surveyaudit.exception.MisconfiguredCheckException;
import com.surveyaudit.model.CheckParameters;
import com.surveyaudit.model.Dataset;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class StraightlinerCheckerTest {

    private final StraightlinerChecker checker = new StraightlinerChecker();

    @Test
    void shouldFlagOnlyRecordsAtOrBelowVarianceThreshold() {
        Dataset dataset = TestDatasets.battery("battery", List.of(
                new double[]{3, 3, 3, 3, 3, 3, 3, 3, 3, 3},
                new double[]{3, 3, 3, 3, 3, 3, 3, 3, 3, 3.3},
                new double[]{3, 3, 3, 3, 3, 3, 3, 3, 3, 3.4},
                new double[]{1, 5, 2, 4, 3, 5, 1, 2, 4, 3}));

        CheckOutcome outcome = checker.check(CheckContext.builder()
                .dataset(dataset)
                .parameters(CheckParameters.of(Map.of("varianceThreshold", 0.01)))
                .build());

        List<Integer> flagged = outcome.findings().stream().map(Finding::recordIndex).toList();
        assertEquals(List.of(0, 1), flagged);
        assertEquals(0.0081, (double) outcome.findings().get(1).details().get("variance"), 1e-9);
        assertEquals(1.0, outcome.findings().get(0).confidence(), 1e-9);
    }

    @Test
    void shouldSkipRecordsWithTooFewAnsweredItems() {
        Dataset dataset = TestDatasets.battery("sparse", List.of(new double[]{4, 4}));

        CheckOutcome outcome = checker.check(CheckContext.builder()
                .dataset(dataset)
                .parameters(CheckParameters.of(checker.defaultParameters()))
                .build());

        assertTrue(outcome.findings().isEmpty());
    }

    @Test
    void shouldRejectUnknownBatteryField() {
        Dataset dataset = TestDatasets.battery("battery", List.of(new double[]{1, 2, 3}));

        CheckContext ctx = CheckContext.builder()
                .dataset(dataset)
                .parameters(CheckParameters.of(Map.of("fields", List.of("b1", "nope"))))
                .build();

        assertThrows(MisconfiguredCheckException.class, () -> checker.check(ctx));
    }
}
