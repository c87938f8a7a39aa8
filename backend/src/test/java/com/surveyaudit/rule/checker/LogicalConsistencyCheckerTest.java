package com.surveyaudit.rule.checker;

import com.surveyaudit.TestDatasets;
import com.surveyaudit.exception.MisconfiguredCheckException;
import com.surveyaudit.model.*;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class LogicalConsistencyCheckerTest {

    private final LogicalConsistencyChecker checker = new LogicalConsistencyChecker();

    private final Dataset dataset = TestDatasets.dataset("cars", List.of(
            TestDatasets.categorical("ownsCar"), TestDatasets.numeric("carCount"), TestDatasets.text("carBrand")), List.of(
            TestDatasets.row("ownsCar", "no", "carCount", 0, "carBrand", ""),
            TestDatasets.row("ownsCar", "no", "carCount", 2, "carBrand", "Volvo"),
            TestDatasets.row("ownsCar", "yes", "carCount", 1, "carBrand", "BMW"),
            TestDatasets.row("ownsCar", "YES", "carCount", 0, "carBrand", "")));

    @Test
    void shouldFlagRecordsWherePremiseHoldsAndConclusionFails() {
        CheckOutcome outcome = run(List.of(
                Map.of("id", "no-car-zero-count",
                        "if", Map.of("field", "ownsCar", "op", "eq", "value", "no"),
                        "then", Map.of("field", "carCount", "op", "eq", "value", 0)),
                Map.of("id", "car-owner-count",
                        "severity", "HIGH",
                        "if", Map.of("field", "ownsCar", "op", "eq", "value", "yes"),
                        "then", Map.of("field", "carCount", "op", "ge", "value", 1))));

        assertEquals(2, outcome.findings().size());
        Finding first = outcome.findings().get(0);
        assertEquals(1, first.recordIndex());
        assertEquals("no-car-zero-count", first.key());
        assertNull(first.severity());
        Finding second = outcome.findings().get(1);
        assertEquals(3, second.recordIndex());
        assertEquals(Severity.HIGH, second.severity());
    }

    @Test
    void shouldSupportPresenceOperators() {
        CheckOutcome outcome = run(List.of(Map.of(
                "if", Map.of("field", "ownsCar", "op", "eq", "value", "no"),
                "then", Map.of("field", "carBrand", "op", "absent"))));

        assertEquals(1, outcome.findings().size());
        assertEquals(1, outcome.findings().get(0).recordIndex());
        assertEquals("rule-1", outcome.findings().get(0).key());
    }

    @Test
    void shouldRejectMalformedRules() {
        assertThrows(MisconfiguredCheckException.class, () -> run(List.of(Map.of(
                "if", Map.of("field", "ownsCar", "op", "matches", "value", "n.*"),
                "then", Map.of("field", "carCount", "op", "eq", "value", 0)))));
        assertThrows(MisconfiguredCheckException.class, () -> run(List.of(Map.of(
                "if", Map.of("field", "ownsCar", "op", "in", "value", "no"),
                "then", Map.of("field", "carCount", "op", "eq", "value", 0)))));
        assertThrows(MisconfiguredCheckException.class, () -> run(List.of(Map.of(
                "if", Map.of("field", "income", "op", "gt", "value", 0),
                "then", Map.of("field", "carCount", "op", "eq", "value", 0)))));
    }

    private CheckOutcome run(List<Map<String, Object>> rules) {
        return checker.check(CheckContext.builder()
                .dataset(dataset)
                .parameters(CheckParameters.of(Map.of("rules", rules)))
                .build());
    }
}
